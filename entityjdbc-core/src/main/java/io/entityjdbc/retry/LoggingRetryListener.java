package io.entityjdbc.retry;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import io.entityjdbc.EntityJdbcProperty;
import io.entityjdbc.util.Assert;
import io.entityjdbc.util.DurationFormat;
import io.entityjdbc.util.ExceptionUtils;

/**
 * Retry listener delegating to a logger.
 */
public class LoggingRetryListener implements RetryListener {
    private final AtomicInteger totalSuccess = new AtomicInteger();

    private final AtomicInteger totalFailures = new AtomicInteger();

    protected final Logger logger;

    private final Marker marker = MarkerFactory.getMarker("RETRY");

    private int maxRetryCount = ExponentialRetryDelayStrategy.DEFAULT_MAX_RETRY_COUNT;

    public LoggingRetryListener() {
        this(LoggerFactory.getLogger(LoggingRetryListener.class));
    }

    public LoggingRetryListener(Logger logger) {
        Assert.notNull(logger, "logger is null");
        this.logger = logger;
    }

    public int getMaxRetryCount() {
        return maxRetryCount;
    }

    public void setMaxRetryCount(int maxRetryCount) {
        Assert.isTrue(maxRetryCount >= 0, "maxRetryCount must be >= 0");
        this.maxRetryCount = maxRetryCount;
    }

    @Override
    public void configure(Properties properties) {
        setMaxRetryCount(Integer.parseInt(EntityJdbcProperty.RETRY_MAX_COUNT.getValue(properties)));
    }

    @Override
    public void beforeRetry(String operationName, int attempt, Throwable ex, Duration backoffDelay) {
        logger.info(marker,
                "Retry started: attempt [{}/{}] for [{}] backoff delay [{}]\n{}",
                attempt, maxRetryCount, operationName, DurationFormat.formatDuration(backoffDelay),
                ExceptionUtils.toNestedString(ex));
    }

    @Override
    public void afterRetry(String operationName, int attempt, Throwable ex, Duration executionTime) {
        if (ex != null) {
            totalFailures.incrementAndGet();
            logger.warn(marker,
                    "Retry failed: attempt [{}/{}] for [{}] time [{}]. Total [{}] successful [{}] failed\n{}",
                    attempt, maxRetryCount, operationName, DurationFormat.formatDuration(executionTime),
                    totalSuccess.get(), totalFailures.get(),
                    ExceptionUtils.toNestedString(ex));
        } else {
            totalSuccess.incrementAndGet();
            logger.info(marker,
                    "Retry successful: attempt [{}/{}] for [{}] time [{}]. Total [{}] successful [{}] failed",
                    attempt, maxRetryCount, operationName, DurationFormat.formatDuration(executionTime),
                    totalSuccess.get(), totalFailures.get());
        }
    }

    public void resetCounters() {
        totalSuccess.set(0);
        totalFailures.set(0);
    }

    public int getTotalSuccessfulRetries() {
        return totalSuccess.get();
    }

    public int getTotalFailedRetries() {
        return totalFailures.get();
    }
}
