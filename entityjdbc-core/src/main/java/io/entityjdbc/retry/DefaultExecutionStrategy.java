package io.entityjdbc.retry;

import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.entityjdbc.util.Assert;
import io.entityjdbc.util.AsyncSqlCallable;
import io.entityjdbc.util.AsyncSqlRunnable;
import io.entityjdbc.util.CancellationToken;
import io.entityjdbc.util.SqlCallable;
import io.entityjdbc.util.SqlRunnable;

/**
 * Execution strategy that runs the operation once and never retries.
 */
public class DefaultExecutionStrategy implements ExecutionStrategy {
    public static final DefaultExecutionStrategy INSTANCE = new DefaultExecutionStrategy();

    @Override
    public boolean isRetriesOnFailure() {
        return false;
    }

    @Override
    public void execute(SqlRunnable operation) throws SQLException {
        Assert.notNull(operation, "operation is null");
        operation.run();
    }

    @Override
    public <T> T execute(SqlCallable<T> operation) throws SQLException {
        Assert.notNull(operation, "operation is null");
        return operation.call();
    }

    @Override
    public CompletableFuture<Void> executeAsync(AsyncSqlRunnable operation, CancellationToken cancellationToken) {
        Assert.notNull(operation, "operation is null");
        return executeAsync((AsyncSqlCallable<Void>) () -> operation.start().thenApply(result -> (Void) null),
                cancellationToken);
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(AsyncSqlCallable<T> operation,
                                                 CancellationToken cancellationToken) {
        Assert.notNull(operation, "operation is null");
        Assert.notNull(cancellationToken, "cancellationToken is null");
        try {
            cancellationToken.throwIfCancellationRequested();
            CompletionStage<T> stage = operation.start();
            Assert.state(stage != null, "Asynchronous operation returned no completion stage");
            return stage.toCompletableFuture();
        } catch (SQLException | RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    @Override
    public String toString() {
        return "DefaultExecutionStrategy";
    }
}
