package io.entityjdbc.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * Computes the delay before the next attempt of a failed operation. An instance tracks the
 * failures of a single execution and is not safe for concurrent use.
 *
 * <p>See {@link ExponentialRetryDelayStrategy}.
 */
@FunctionalInterface
public interface RetryDelayStrategy {
    /**
     * Record a failed attempt and determine the delay before the next one.
     *
     * @param lastException the exception thrown by the most recent attempt
     * @return the delay before the next attempt, or empty if the operation should not be
     * retried again
     */
    Optional<Duration> getNextDelay(Throwable lastException);
}
