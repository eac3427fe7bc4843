package io.entityjdbc.retry;

import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import io.entityjdbc.util.AsyncSqlRunnable;
import io.entityjdbc.util.CancellationToken;
import io.entityjdbc.util.SqlRunnable;

@Tag("unit-test")
public class DefaultExecutionStrategyTest {
    @Test
    public void whenTransientFailure_expectSameExceptionWithoutRetry() {
        AtomicInteger executions = new AtomicInteger();
        SQLTransientException failure = new SQLTransientException("Disturbance!");

        SQLTransientException ex = Assertions.assertThrows(SQLTransientException.class,
                () -> DefaultExecutionStrategy.INSTANCE.execute((SqlRunnable) () -> {
                    executions.incrementAndGet();
                    throw failure;
                }));

        Assertions.assertSame(failure, ex);
        Assertions.assertEquals(1, executions.get());
        Assertions.assertFalse(DefaultExecutionStrategy.INSTANCE.isRetriesOnFailure());
    }

    @Test
    public void whenInAmbientTransaction_expectExecution() throws SQLException {
        try (TransactionScope ignored = TransactionScope.begin()) {
            Assertions.assertEquals("ok", DefaultExecutionStrategy.INSTANCE.execute(() -> "ok"));
        }
    }

    @Test
    public void whenExecutingAsync_expectResult() throws Exception {
        CompletableFuture<String> future = DefaultExecutionStrategy.INSTANCE.executeAsync(
                () -> CompletableFuture.completedFuture("ok"), CancellationToken.NONE);

        Assertions.assertEquals("ok", future.get(5, TimeUnit.SECONDS));
    }

    @Test
    public void whenAsyncFailure_expectSameException() {
        SQLException failure = new SQLException("Disturbance!", "40001");

        CompletableFuture<Void> future = DefaultExecutionStrategy.INSTANCE.executeAsync(
                (AsyncSqlRunnable) () -> {
                    throw failure;
                }, CancellationToken.NONE);

        ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                () -> future.get(5, TimeUnit.SECONDS));
        Assertions.assertSame(failure, ex.getCause());
    }

    @Test
    public void whenTokenCancelled_expectCancelledWithoutExecution() {
        AtomicInteger executions = new AtomicInteger();

        CompletableFuture<Integer> future = DefaultExecutionStrategy.INSTANCE.executeAsync(() -> {
            executions.incrementAndGet();
            return CompletableFuture.completedFuture(1);
        }, CancellationToken.cancelled());

        Assertions.assertTrue(future.isCancelled());
        Assertions.assertEquals(0, executions.get());
    }
}
