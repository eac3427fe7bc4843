package io.entityjdbc.retry;

import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;

import io.entityjdbc.util.AsyncSqlCallable;
import io.entityjdbc.util.AsyncSqlRunnable;
import io.entityjdbc.util.CancellationToken;
import io.entityjdbc.util.SqlCallable;
import io.entityjdbc.util.SqlRunnable;

/**
 * Interface specifying the API to be implemented by a class that runs a unit of work against
 * the database, optionally retrying it on transient failures.
 *
 * <p>See {@link DefaultExecutionStrategy} and {@link SqlStateExecutionStrategy}.
 */
public interface ExecutionStrategy {
    /**
     * @return true if this strategy may retry a failed operation from the current context
     */
    boolean isRetriesOnFailure();

    void execute(SqlRunnable operation) throws SQLException;

    <T> T execute(SqlCallable<T> operation) throws SQLException;

    CompletableFuture<Void> executeAsync(AsyncSqlRunnable operation, CancellationToken cancellationToken);

    /**
     * Run an asynchronous operation. Failures, including precondition violations, are reported
     * through the returned future. A cancelled token yields a future completed with a
     * {@link java.util.concurrent.CancellationException}.
     *
     * @param operation the operation, started once per attempt
     * @param cancellationToken token observed before the first attempt and during delays
     * @param <T> result type
     * @return future of the operation result
     * @throws IllegalArgumentException if an argument is null
     */
    <T> CompletableFuture<T> executeAsync(AsyncSqlCallable<T> operation, CancellationToken cancellationToken);
}
