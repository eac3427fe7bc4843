package io.entityjdbc.intercept;

import org.postgresql.util.PSQLState;

import io.entityjdbc.NonTransientEntityJdbcException;

/**
 * Thrown when a {@link CancelableCommandInterceptor} vetoed the execution of a command.
 */
public class CommandCanceledException extends NonTransientEntityJdbcException {
    public CommandCanceledException(String reason) {
        super(reason, PSQLState.QUERY_CANCELED);
    }
}
