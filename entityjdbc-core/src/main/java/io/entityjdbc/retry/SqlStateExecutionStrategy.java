package io.entityjdbc.retry;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.Collections;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

import org.postgresql.util.PSQLState;

import io.entityjdbc.EntityJdbcProperty;
import io.entityjdbc.util.Assert;
import io.entityjdbc.util.DurationFormat;

/**
 * Execution strategy classifying failures by SQL state. Serialization failures and deadlocks
 * are transient, and so are connection errors if enabled.
 */
public class SqlStateExecutionStrategy extends AbstractExecutionStrategy {
    /**
     * Deadlock detected, not available as a constant in older driver releases.
     */
    public static final String DEADLOCK_DETECTED = "40P01";

    /**
     * The server is not accepting new transactions on existing connections.
     */
    public static final String ADMIN_SHUTDOWN = "57P01";

    private final Set<String> transientStates = new CopyOnWriteArraySet<>();

    private volatile boolean retryConnectionErrors;

    public SqlStateExecutionStrategy() {
        this(DEFAULT_MAX_RETRY_COUNT, DEFAULT_MAX_DELAY);
    }

    public SqlStateExecutionStrategy(int maxRetryCount, Duration maxDelay) {
        super(maxRetryCount, maxDelay);
        transientStates.add(PSQLState.SERIALIZATION_FAILURE.getState());
        transientStates.add(DEADLOCK_DETECTED);
    }

    /**
     * Configure from properties, see {@link EntityJdbcProperty}.
     *
     * @param properties the configuration properties
     */
    public void configure(Properties properties) {
        setMaxRetryCount(Integer.parseInt(EntityJdbcProperty.RETRY_MAX_COUNT.getValue(properties)));
        setMaxDelay(DurationFormat.parseDuration(EntityJdbcProperty.RETRY_MAX_DELAY.getValue(properties)));
        setRetryConnectionErrors(
                Boolean.parseBoolean(EntityJdbcProperty.RETRY_CONNECTION_ERRORS.getValue(properties)));
    }

    public boolean isRetryConnectionErrors() {
        return retryConnectionErrors;
    }

    public void setRetryConnectionErrors(boolean retryConnectionErrors) {
        this.retryConnectionErrors = retryConnectionErrors;
    }

    public void addTransientState(String sqlState) {
        Assert.hasText(sqlState, "sqlState is empty");
        transientStates.add(sqlState);
    }

    public Set<String> getTransientStates() {
        return Collections.unmodifiableSet(transientStates);
    }

    public boolean isConnectionError(String sqlState) {
        return PSQLState.isConnectionError(sqlState)
                || PSQLState.COMMUNICATION_ERROR.getState().equals(sqlState)
                || ADMIN_SHUTDOWN.equals(sqlState);
    }

    @Override
    protected boolean shouldRetryOn(Throwable ex) {
        if (!(ex instanceof SQLException)) {
            return false;
        }
        for (SQLException next = (SQLException) ex; next != null; next = next.getNextException()) {
            String sqlState = next.getSQLState();
            if (sqlState == null) {
                continue;
            }
            if (transientStates.contains(sqlState)) {
                return true;
            }
            if (retryConnectionErrors && isConnectionError(sqlState)) {
                return true;
            }
        }
        if (ex instanceof SQLTransientConnectionException) {
            return retryConnectionErrors;
        }
        return ex instanceof SQLTransientException;
    }

    @Override
    public String toString() {
        return "SqlStateExecutionStrategy{" +
                "maxRetryCount=" + getMaxRetryCount() +
                ", maxDelay=" + getMaxDelay() +
                ", retryConnectionErrors=" + retryConnectionErrors +
                ", transientStates=" + transientStates +
                '}';
    }
}
