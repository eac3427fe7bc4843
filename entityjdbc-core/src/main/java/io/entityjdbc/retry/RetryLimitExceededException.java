package io.entityjdbc.retry;

import java.sql.SQLException;

import org.postgresql.util.PSQLState;

import io.entityjdbc.NonTransientEntityJdbcException;
import io.entityjdbc.util.ExceptionUtils;

/**
 * Thrown when an operation kept failing with transient errors and the execution strategy
 * gave up. The cause is the exception from the last attempt.
 */
public class RetryLimitExceededException extends NonTransientEntityJdbcException {
    public RetryLimitExceededException(String reason, Throwable cause) {
        super(reason, stateOf(cause), cause);
    }

    private static PSQLState stateOf(Throwable cause) {
        if (cause instanceof SQLException) {
            return ExceptionUtils.toPSQLState(((SQLException) cause).getSQLState());
        }
        return PSQLState.UNKNOWN_STATE;
    }
}
