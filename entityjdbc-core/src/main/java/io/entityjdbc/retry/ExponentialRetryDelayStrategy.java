package io.entityjdbc.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import io.entityjdbc.util.Assert;

/**
 * Retry delay strategy using exponential backoff with jitter. For the n:th retry (0-based)
 * the delay is:
 * <pre>
 * min(minDelay + coefficient * (exponentialBase^n - 1) * (1 + random * (maxRandomFactor - 1)), maxDelay)
 * </pre>
 * where random is uniformly distributed in [0, 1). The jitter spreads out retries of
 * concurrent operations that failed at the same time.
 */
public class ExponentialRetryDelayStrategy implements RetryDelayStrategy {
    public static final int DEFAULT_MAX_RETRY_COUNT = 5;

    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    public static final Duration DEFAULT_MIN_DELAY = Duration.ZERO;

    public static final double DEFAULT_RANDOM_FACTOR = 1.1;

    public static final double DEFAULT_EXPONENTIAL_BASE = 2;

    public static final Duration DEFAULT_COEFFICIENT = Duration.ofSeconds(1);

    private final List<Throwable> exceptionsEncountered = new ArrayList<>();

    private final int maxRetryCount;

    private final Duration minDelay;

    private final Duration maxDelay;

    private final double maxRandomFactor;

    private final double exponentialBase;

    private final Duration coefficient;

    public ExponentialRetryDelayStrategy() {
        this(DEFAULT_MAX_RETRY_COUNT, DEFAULT_MAX_DELAY);
    }

    public ExponentialRetryDelayStrategy(int maxRetryCount, Duration maxDelay) {
        this(maxRetryCount, DEFAULT_MIN_DELAY, maxDelay, DEFAULT_RANDOM_FACTOR,
                DEFAULT_EXPONENTIAL_BASE, DEFAULT_COEFFICIENT);
    }

    /**
     * Creates a new instance.
     *
     * @param maxRetryCount maximum number of retries, 0 disables retrying
     * @param minDelay delay before the first retry and lower bound of every delay
     * @param maxDelay upper bound of every delay
     * @param maxRandomFactor upper bound of the jitter multiplier, 1 disables jitter
     * @param exponentialBase base of the exponential growth
     * @param coefficient unit of the exponential term
     * @throws IllegalArgumentException if any argument is out of range
     */
    public ExponentialRetryDelayStrategy(int maxRetryCount,
                                         Duration minDelay,
                                         Duration maxDelay,
                                         double maxRandomFactor,
                                         double exponentialBase,
                                         Duration coefficient) {
        Assert.isTrue(maxRetryCount >= 0, "maxRetryCount must be >= 0");
        Assert.notNull(minDelay, "minDelay is null");
        Assert.notNull(maxDelay, "maxDelay is null");
        Assert.notNull(coefficient, "coefficient is null");
        Assert.isTrue(!minDelay.isNegative(), "minDelay must be >= 0");
        Assert.isTrue(maxDelay.compareTo(minDelay) >= 0, "maxDelay must be >= minDelay");
        Assert.isTrue(maxRandomFactor >= 1.0, "maxRandomFactor must be >= 1");
        Assert.isTrue(exponentialBase > 0, "exponentialBase must be > 0");
        Assert.isTrue(!coefficient.isNegative(), "coefficient must be >= 0");

        this.maxRetryCount = maxRetryCount;
        this.minDelay = minDelay;
        this.maxDelay = maxDelay;
        this.maxRandomFactor = maxRandomFactor;
        this.exponentialBase = exponentialBase;
        this.coefficient = coefficient;
    }

    @Override
    public Optional<Duration> getNextDelay(Throwable lastException) {
        exceptionsEncountered.add(lastException);

        int retryCount = exceptionsEncountered.size() - 1;
        if (retryCount >= maxRetryCount) {
            return Optional.empty();
        }

        double jitter = 1.0 + ThreadLocalRandom.current().nextDouble() * (maxRandomFactor - 1.0);
        double delta = (Math.pow(exponentialBase, retryCount) - 1.0) * jitter;
        double delayMillis = Math.min(minDelay.toMillis() + coefficient.toMillis() * delta,
                maxDelay.toMillis());

        return Optional.of(Duration.ofMillis((long) delayMillis));
    }

    /**
     * @return the exceptions recorded so far, where the index is the retry count
     */
    public List<Throwable> getExceptionsEncountered() {
        return Collections.unmodifiableList(exceptionsEncountered);
    }

    public int getMaxRetryCount() {
        return maxRetryCount;
    }

    public Duration getMinDelay() {
        return minDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getMaxRandomFactor() {
        return maxRandomFactor;
    }

    public double getExponentialBase() {
        return exponentialBase;
    }

    public Duration getCoefficient() {
        return coefficient;
    }

    @Override
    public String toString() {
        return "ExponentialRetryDelayStrategy{" +
                "maxRetryCount=" + maxRetryCount +
                ", minDelay=" + minDelay +
                ", maxDelay=" + maxDelay +
                ", maxRandomFactor=" + maxRandomFactor +
                ", exponentialBase=" + exponentialBase +
                ", coefficient=" + coefficient +
                '}';
    }
}
