package io.entityjdbc.retry;

import java.time.Duration;
import java.util.Properties;

/**
 * Interface specifying the API to be implemented by a class receiving callbacks when an
 * execution strategy retries an operation.
 *
 * <p>See {@link LoggingRetryListener}.
 */
@SuppressWarnings("EmptyMethod")
public interface RetryListener {
    /**
     * Configure the listener, if supported.
     *
     * @param properties the configuration properties
     */
    void configure(Properties properties);

    /**
     * Invoked before waiting for the next attempt.
     *
     * @param operationName name of the strategy operation being retried
     * @param attempt the upcoming retry attempt, 1-based
     * @param ex the transient exception that triggered the retry
     * @param backoffDelay delay before the retry
     */
    default void beforeRetry(String operationName, int attempt, Throwable ex, Duration backoffDelay) {
    }

    /**
     * Invoked when a retry attempt completed, regardless whether it succeeded or failed.
     *
     * @param operationName name of the strategy operation being retried
     * @param attempt the retry attempt, 1-based
     * @param ex the exception from the attempt, or null if it was successful
     * @param executionTime total time spent since the first attempt
     */
    default void afterRetry(String operationName, int attempt, Throwable ex, Duration executionTime) {
    }
}
