package io.entityjdbc.retry;

import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.function.Predicate;

/**
 * Strategy without delays treating {@link SQLTransientException} as transient, unless told
 * otherwise.
 */
class TestExecutionStrategy extends AbstractExecutionStrategy {
    private final Predicate<Throwable> transientPredicate;

    TestExecutionStrategy(int maxRetryCount) {
        this(maxRetryCount, ex -> ex instanceof SQLTransientException);
    }

    TestExecutionStrategy(int maxRetryCount, Predicate<Throwable> transientPredicate) {
        super(maxRetryCount, Duration.ZERO);
        this.transientPredicate = transientPredicate;
    }

    @Override
    protected boolean shouldRetryOn(Throwable ex) {
        return transientPredicate.test(ex);
    }
}
