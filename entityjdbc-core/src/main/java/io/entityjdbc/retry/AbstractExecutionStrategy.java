package io.entityjdbc.retry;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.postgresql.util.PSQLState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.entityjdbc.DbUpdateException;
import io.entityjdbc.EntityCommandException;
import io.entityjdbc.EntityJdbcException;
import io.entityjdbc.UpdateException;
import io.entityjdbc.util.Assert;
import io.entityjdbc.util.AsyncSqlCallable;
import io.entityjdbc.util.AsyncSqlRunnable;
import io.entityjdbc.util.CancellationToken;
import io.entityjdbc.util.ExceptionUtils;
import io.entityjdbc.util.SqlCallable;
import io.entityjdbc.util.SqlRunnable;

/**
 * Base class for execution strategies that retry operations failing with transient errors.
 * Subclasses decide what is transient by implementing {@link #shouldRetryOn(Throwable)}.
 *
 * <p>Instances are reusable and thread safe provided subclasses are. Each invocation tracks
 * its own retry state. While an attempt is in progress, strategies invoked from within the
 * operation do not retry, leaving that to the outermost one.
 */
public abstract class AbstractExecutionStrategy implements ExecutionStrategy {
    public static final int DEFAULT_MAX_RETRY_COUNT = ExponentialRetryDelayStrategy.DEFAULT_MAX_RETRY_COUNT;

    public static final Duration DEFAULT_MAX_DELAY = ExponentialRetryDelayStrategy.DEFAULT_MAX_DELAY;

    private static final String OPERATION_NAME = "execute";

    private static final String ASYNC_OPERATION_NAME = "executeAsync";

    public static final String RETRY_ATTEMPT_KEY = "retry.attempt";

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private volatile int maxRetryCount;

    private volatile Duration maxDelay;

    private volatile RetryListener retryListener = EmptyRetryListener.INSTANCE;

    protected AbstractExecutionStrategy() {
        this(DEFAULT_MAX_RETRY_COUNT, DEFAULT_MAX_DELAY);
    }

    protected AbstractExecutionStrategy(int maxRetryCount, Duration maxDelay) {
        setMaxRetryCount(maxRetryCount);
        setMaxDelay(maxDelay);
    }

    /**
     * Strip exception wrappers added by the data access layers and pass the innermost
     * exception to the handler. The handler receives null if a wrapper has no cause.
     *
     * @param ex the exception thrown by an operation
     * @param handler the handler receiving the unwrapped exception
     * @param <T> handler result type
     * @return the handler result
     */
    public static <T> T unwrapAndHandleException(Throwable ex, Function<Throwable, T> handler) {
        Assert.notNull(handler, "handler is null");
        Throwable cause = ex;
        while (cause instanceof EntityCommandException
                || cause instanceof DbUpdateException
                || cause instanceof UpdateException) {
            cause = cause.getCause();
        }
        return handler.apply(cause);
    }

    public int getMaxRetryCount() {
        return maxRetryCount;
    }

    public void setMaxRetryCount(int maxRetryCount) {
        Assert.isTrue(maxRetryCount >= 0, "maxRetryCount must be >= 0");
        this.maxRetryCount = maxRetryCount;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        Assert.notNull(maxDelay, "maxDelay is null");
        Assert.isTrue(!maxDelay.isNegative(), "maxDelay must be >= 0");
        this.maxDelay = maxDelay;
    }

    public RetryListener getRetryListener() {
        return retryListener;
    }

    public void setRetryListener(RetryListener retryListener) {
        Assert.notNull(retryListener, "retryListener is null");
        this.retryListener = retryListener;
    }

    @Override
    public boolean isRetriesOnFailure() {
        return !ExecutionSuspension.isSuspended();
    }

    /**
     * Determine whether the given exception represents a transient failure that may be
     * resolved by retrying the operation.
     *
     * @param ex the unwrapped exception, may be null
     * @return true if the operation should be retried
     */
    protected abstract boolean shouldRetryOn(Throwable ex);

    /**
     * Create the per-invocation retry state.
     *
     * @return a new delay strategy
     */
    protected RetryDelayStrategy createRetryDelayStrategy() {
        return new ExponentialRetryDelayStrategy(maxRetryCount, maxDelay);
    }

    protected Optional<Duration> getNextDelay(RetryDelayStrategy retryDelayStrategy, Throwable lastException) {
        return retryDelayStrategy.getNextDelay(lastException);
    }

    /**
     * @return true if a user-initiated transaction is active on the calling thread
     */
    protected boolean isInAmbientTransaction() {
        return TransactionScope.isActive();
    }

    protected void ensurePreexecutionState() {
        if (isInAmbientTransaction()) {
            throw new IllegalStateException("The execution strategy " + getClass().getSimpleName()
                    + " does not support user-initiated transactions. Run the unit of work"
                    + " through the execution strategy to make it retriable as a whole.");
        }
    }

    @Override
    public void execute(SqlRunnable operation) throws SQLException {
        Assert.notNull(operation, "operation is null");
        execute(() -> {
            operation.run();
            return null;
        });
    }

    @Override
    public <T> T execute(SqlCallable<T> operation) throws SQLException {
        Assert.notNull(operation, "operation is null");

        if (ExecutionSuspension.isSuspended()) {
            return operation.call();
        }

        ensurePreexecutionState();

        final RetryDelayStrategy retryDelayStrategy = createRetryDelayStrategy();
        final Instant startTime = Instant.now();

        try {
            for (int attempt = 0; ; attempt++) {
                Throwable lastException;

                try (ExecutionSuspension.Scope ignored = ExecutionSuspension.suspend()) {
                    T result = operation.call();
                    if (attempt > 0) {
                        retryListener.afterRetry(OPERATION_NAME, attempt, null,
                                Duration.between(startTime, Instant.now()));
                    }
                    return result;
                } catch (SQLException | RuntimeException ex) {
                    if (attempt > 0) {
                        retryListener.afterRetry(OPERATION_NAME, attempt, ex,
                                Duration.between(startTime, Instant.now()));
                    }
                    lastException = ex;
                }

                Duration delay = nextDelay(retryDelayStrategy, lastException, attempt);

                MDC.put(RETRY_ATTEMPT_KEY, String.valueOf(attempt + 1));

                retryListener.beforeRetry(OPERATION_NAME, attempt + 1, lastException, delay);

                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    EntityJdbcException interrupted = new EntityJdbcException(
                            "Interrupted while waiting to retry", PSQLState.UNKNOWN_STATE, ex);
                    interrupted.addSuppressed(lastException);
                    throw interrupted;
                }
            }
        } finally {
            MDC.remove(RETRY_ATTEMPT_KEY);
        }
    }

    /**
     * Classify the exception thrown by an attempt and compute the delay before the next one.
     * Throws the exception to propagate if the operation must not be retried.
     */
    private Duration nextDelay(RetryDelayStrategy retryDelayStrategy, Throwable lastException, int attempt)
            throws SQLException {
        if (!unwrapAndHandleException(lastException, this::shouldRetryOn)) {
            throw ExceptionUtils.<RuntimeException>rethrow(lastException);
        }

        Optional<Duration> delay = getNextDelay(retryDelayStrategy, lastException);
        if (delay.isEmpty()) {
            throw new RetryLimitExceededException("Maximum number of retries [" + maxRetryCount
                    + "] exceeded when executing operation with " + getClass().getSimpleName()
                    + ". See the inner exception for the most recent failure.", lastException);
        }

        if (delay.get().isNegative()) {
            throw new IllegalStateException("The retry delay strategy of " + getClass().getSimpleName()
                    + " returned a negative delay [" + delay.get() + "]");
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Transient failure in attempt [{}], retrying in [{}]\n{}",
                    attempt + 1, delay.get(), ExceptionUtils.toNestedString(lastException));
        }

        return delay.get();
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

        if (ExecutionSuspension.isSuspended()) {
            return start(operation);
        }

        try {
            ensurePreexecutionState();
            cancellationToken.throwIfCancellationRequested();
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        attemptAsync(operation, cancellationToken, createRetryDelayStrategy(), result, 0, Instant.now());
        return result;
    }

    private <T> void attemptAsync(AsyncSqlCallable<T> operation,
                                  CancellationToken cancellationToken,
                                  RetryDelayStrategy retryDelayStrategy,
                                  CompletableFuture<T> result,
                                  int attempt,
                                  Instant startTime) {
        CompletableFuture<T> future;
        try (ExecutionSuspension.Scope ignored = ExecutionSuspension.suspend();
             MDC.MDCCloseable mdc = retryAttempt(attempt)) {
            future = start(operation);
        }

        future.whenComplete((value, failure) -> {
            try (MDC.MDCCloseable ignored = retryAttempt(attempt)) {
                onAttemptCompleted(operation, cancellationToken, retryDelayStrategy, result,
                        attempt, startTime, value, failure);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
    }

    private <T> void onAttemptCompleted(AsyncSqlCallable<T> operation,
                                        CancellationToken cancellationToken,
                                        RetryDelayStrategy retryDelayStrategy,
                                        CompletableFuture<T> result,
                                        int attempt,
                                        Instant startTime,
                                        T value,
                                        Throwable failure) {
        Throwable ex = failure != null ? ExceptionUtils.unwrapCompletionException(failure) : null;

        if (attempt > 0) {
            retryListener.afterRetry(ASYNC_OPERATION_NAME, attempt, ex,
                    Duration.between(startTime, Instant.now()));
        }

        if (ex == null) {
            result.complete(value);
            return;
        }

        if (ex instanceof CancellationException || result.isDone()) {
            result.completeExceptionally(ex);
            return;
        }

        Duration delay;
        try {
            delay = nextDelay(retryDelayStrategy, ex, attempt);
            cancellationToken.throwIfCancellationRequested();
        } catch (SQLException e) {
            result.completeExceptionally(e);
            return;
        }

        try (MDC.MDCCloseable ignored = retryAttempt(attempt + 1)) {
            retryListener.beforeRetry(ASYNC_OPERATION_NAME, attempt + 1, ex, delay);
        }

        Executor delayedExecutor = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS);
        CompletableFuture<Void> wait = CompletableFuture.runAsync(() -> {
        }, delayedExecutor);
        CancellationToken.Registration registration = cancellationToken.onCancel(() -> wait.cancel(false));

        wait.whenComplete((v, waitFailure) -> {
            try {
                registration.close();
                if (waitFailure != null) {
                    result.completeExceptionally(ExceptionUtils.unwrapCompletionException(waitFailure));
                } else if (!result.isDone()) {
                    attemptAsync(operation, cancellationToken, retryDelayStrategy, result,
                            attempt + 1, startTime);
                }
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
    }

    /**
     * Put the attempt number into the MDC of the calling thread for retries, leaving the first
     * attempt unmarked. Closing the returned handle removes the key.
     */
    private static MDC.MDCCloseable retryAttempt(int attempt) {
        return attempt > 0 ? MDC.putCloseable(RETRY_ATTEMPT_KEY, String.valueOf(attempt)) : null;
    }

    private static <T> CompletableFuture<T> start(AsyncSqlCallable<T> operation) {
        try {
            CompletionStage<T> stage = operation.start();
            if (stage == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Asynchronous operation returned no completion stage"));
            }
            return stage.toCompletableFuture();
        } catch (SQLException | RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "maxRetryCount=" + maxRetryCount +
                ", maxDelay=" + maxDelay +
                '}';
    }
}
