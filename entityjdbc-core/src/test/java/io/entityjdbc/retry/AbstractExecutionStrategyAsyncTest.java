package io.entityjdbc.retry;

import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.slf4j.MDC;

import io.entityjdbc.util.AsyncSqlCallable;
import io.entityjdbc.util.AsyncSqlRunnable;
import io.entityjdbc.util.CancellationToken;

@Tag("unit-test")
public class AbstractExecutionStrategyAsyncTest {
    @Test
    public void whenTransientFailuresThenSuccess_expectResultAfterRetries() throws Exception {
        AbstractExecutionStrategy strategy = new TestExecutionStrategy(5);
        AtomicInteger executions = new AtomicInteger();

        CompletableFuture<String> future = strategy.executeAsync(() -> {
            if (executions.incrementAndGet() < 3) {
                return CompletableFuture.failedFuture(new SQLTransientException("Disturbance!"));
            }
            return CompletableFuture.supplyAsync(() -> "done");
        }, CancellationToken.NONE);

        Assertions.assertEquals("done", future.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(3, executions.get());
    }

    @Test
    public void whenOperationThrowsBeforeReturningFuture_expectRetry() throws Exception {
        AbstractExecutionStrategy strategy = new TestExecutionStrategy(5);
        AtomicInteger executions = new AtomicInteger();

        CompletableFuture<Integer> future = strategy.executeAsync(() -> {
            if (executions.incrementAndGet() < 2) {
                throw new SQLTransientException("Disturbance!");
            }
            return CompletableFuture.completedFuture(7);
        }, CancellationToken.NONE);

        Assertions.assertEquals(7, future.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(2, executions.get());
    }

    @Test
    public void whenAlwaysTransient_expectRetryLimitExceeded() {
        AbstractExecutionStrategy strategy = new TestExecutionStrategy(2);
        AtomicInteger executions = new AtomicInteger();

        CompletableFuture<Void> future = strategy.executeAsync((AsyncSqlRunnable) () -> {
            executions.incrementAndGet();
            return CompletableFuture.failedFuture(new SQLTransientException("Disturbance!"));
        }, CancellationToken.NONE);

        ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                () -> future.get(5, TimeUnit.SECONDS));

        Assertions.assertInstanceOf(RetryLimitExceededException.class, ex.getCause());
        Assertions.assertInstanceOf(SQLTransientException.class, ex.getCause().getCause());
        Assertions.assertEquals(3, executions.get());
    }

    @Test
    public void whenNonTransientFailure_expectSameExceptionWithoutRetry() {
        AbstractExecutionStrategy strategy = new TestExecutionStrategy(2);
        AtomicInteger executions = new AtomicInteger();
        SQLException failure = new SQLException("Constraint violation", "23505");

        CompletableFuture<Object> future = strategy.executeAsync(() -> {
            executions.incrementAndGet();
            return CompletableFuture.failedFuture(failure);
        }, CancellationToken.NONE);

        ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                () -> future.get(5, TimeUnit.SECONDS));

        Assertions.assertSame(failure, ex.getCause());
        Assertions.assertEquals(1, executions.get());
    }

    @Test
    public void whenTokenAlreadyCancelled_expectCancelledWithoutExecution() {
        AbstractExecutionStrategy strategy = new TestExecutionStrategy(2);
        AtomicInteger executions = new AtomicInteger();

        CompletableFuture<Integer> future = strategy.executeAsync(() -> {
            executions.incrementAndGet();
            return CompletableFuture.completedFuture(1);
        }, CancellationToken.cancelled());

        Assertions.assertTrue(future.isCancelled());
        Assertions.assertEquals(0, executions.get());
    }

    @Test
    public void whenInAmbientTransactionAndCancelled_expectTransactionCheckFirst() {
        AbstractExecutionStrategy strategy = new TestExecutionStrategy(2);

        CompletableFuture<Integer> future;
        try (TransactionScope ignored = TransactionScope.begin()) {
            future = strategy.executeAsync(() -> CompletableFuture.completedFuture(1),
                    CancellationToken.cancelled());
        }

        ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                () -> future.get(5, TimeUnit.SECONDS));
        Assertions.assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    public void whenCancelledDuringDelay_expectCancelledWithoutFurtherAttempts() {
        AbstractExecutionStrategy strategy = new TestExecutionStrategy(5) {
            @Override
            protected RetryDelayStrategy createRetryDelayStrategy() {
                return lastException -> Optional.of(Duration.ofMinutes(1));
            }
        };
        AtomicInteger executions = new AtomicInteger();
        CancellationToken token = CancellationToken.create();

        CompletableFuture<Integer> future = strategy.executeAsync(() -> {
            executions.incrementAndGet();
            return CompletableFuture.failedFuture(new SQLTransientException("Disturbance!"));
        }, token);

        Assertions.assertFalse(future.isDone());

        token.cancel();

        Assertions.assertThrows(CancellationException.class, () -> future.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(1, executions.get());
    }

    @Test
    public void whenNestedAsyncStrategies_expectOnlyOutermostToRetry() {
        AbstractExecutionStrategy outer = new TestExecutionStrategy(2);
        AbstractExecutionStrategy inner = new TestExecutionStrategy(2);
        AtomicInteger executions = new AtomicInteger();

        CompletableFuture<Object> future = outer.executeAsync(
                () -> inner.executeAsync(() -> {
                    executions.incrementAndGet();
                    return CompletableFuture.failedFuture(new SQLTransientException("Disturbance!"));
                }, CancellationToken.NONE),
                CancellationToken.NONE);

        ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                () -> future.get(5, TimeUnit.SECONDS));

        Assertions.assertInstanceOf(RetryLimitExceededException.class, ex.getCause());
        Assertions.assertEquals(3, executions.get());
    }

    @Test
    public void whenNullArguments_expectIllegalArgument() {
        AbstractExecutionStrategy strategy = new TestExecutionStrategy(2);

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> strategy.executeAsync((AsyncSqlCallable<Object>) null, CancellationToken.NONE));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> strategy.executeAsync((AsyncSqlRunnable) null, CancellationToken.NONE));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> strategy.executeAsync(() -> CompletableFuture.completedFuture(1), null));
    }

    @Test
    public void whenNestedStrategyInBoundContinuation_expectOnlyOutermostToRetry() throws InterruptedException {
        AbstractExecutionStrategy outer = new TestExecutionStrategy(2);
        AbstractExecutionStrategy inner = new TestExecutionStrategy(2);
        AtomicInteger executions = new AtomicInteger();
        AsyncSqlCallable<Integer> alwaysTransient = () -> {
            executions.incrementAndGet();
            return CompletableFuture.failedFuture(new SQLTransientException("Disturbance!"));
        };
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            CompletableFuture<Integer> future = outer.executeAsync(() -> {
                Executor executor = ExecutionSuspension.bind(pool);
                return CompletableFuture.supplyAsync(() -> 1, executor)
                        .thenComposeAsync(v -> inner.executeAsync(alwaysTransient, CancellationToken.NONE),
                                executor);
            }, CancellationToken.NONE);

            ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                    () -> future.get(5, TimeUnit.SECONDS));

            Assertions.assertInstanceOf(RetryLimitExceededException.class, ex.getCause());
            Assertions.assertEquals(3, executions.get());
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    public void whenBeforeRetryListenerThrows_expectFailedFuture() {
        IllegalStateException broken = new IllegalStateException("Broken listener");
        RetryListener listenerMock = Mockito.mock(RetryListener.class);
        Mockito.doThrow(broken).when(listenerMock).beforeRetry(
                Mockito.anyString(), Mockito.anyInt(), Mockito.any(), Mockito.any());
        AbstractExecutionStrategy strategy = new TestExecutionStrategy(2);
        strategy.setRetryListener(listenerMock);
        AtomicInteger executions = new AtomicInteger();

        CompletableFuture<Integer> future = strategy.executeAsync(() -> {
            executions.incrementAndGet();
            return CompletableFuture.failedFuture(new SQLTransientException("Disturbance!"));
        }, CancellationToken.NONE);

        ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                () -> future.get(5, TimeUnit.SECONDS));

        Assertions.assertSame(broken, ex.getCause());
        Assertions.assertEquals(1, executions.get());
    }

    @Test
    public void whenAfterRetryListenerThrows_expectFailedFuture() {
        IllegalStateException broken = new IllegalStateException("Broken listener");
        RetryListener listenerMock = Mockito.mock(RetryListener.class);
        Mockito.doThrow(broken).when(listenerMock).afterRetry(
                Mockito.anyString(), Mockito.anyInt(), Mockito.any(), Mockito.any());
        AbstractExecutionStrategy strategy = new TestExecutionStrategy(2);
        strategy.setRetryListener(listenerMock);
        AtomicInteger executions = new AtomicInteger();

        CompletableFuture<Integer> future = strategy.executeAsync(() -> {
            if (executions.incrementAndGet() < 2) {
                return CompletableFuture.failedFuture(new SQLTransientException("Disturbance!"));
            }
            return CompletableFuture.completedFuture(1);
        }, CancellationToken.NONE);

        ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                () -> future.get(5, TimeUnit.SECONDS));

        Assertions.assertSame(broken, ex.getCause());
        Assertions.assertEquals(2, executions.get());
    }

    @Test
    public void whenRetryingAsync_expectAttemptNumberInMdc() throws Exception {
        AbstractExecutionStrategy strategy = new TestExecutionStrategy(5);
        List<String> attempts = new CopyOnWriteArrayList<>();

        CompletableFuture<Integer> future = strategy.executeAsync(() -> {
            attempts.add(String.valueOf(MDC.get(AbstractExecutionStrategy.RETRY_ATTEMPT_KEY)));
            if (attempts.size() < 3) {
                return CompletableFuture.failedFuture(new SQLTransientException("Disturbance!"));
            }
            return CompletableFuture.completedFuture(attempts.size());
        }, CancellationToken.NONE);

        Assertions.assertEquals(3, future.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(List.of("null", "1", "2"), attempts);
        Assertions.assertNull(MDC.get(AbstractExecutionStrategy.RETRY_ATTEMPT_KEY));
    }
}
