package io.entityjdbc;

import java.sql.SQLNonTransientException;

import org.postgresql.util.PSQLState;

/**
 * Non-transient SQL exception type raised by this library. Retrying the failed operation
 * without intervention will fail again.
 */
public abstract class NonTransientEntityJdbcException extends SQLNonTransientException {
    public NonTransientEntityJdbcException(String msg, PSQLState state) {
        super(msg, state == null ? null : state.getState());
    }

    public NonTransientEntityJdbcException(String msg,
                                           PSQLState state,
                                           Throwable cause) {
        super(msg, state == null ? null : state.getState(), cause);
    }
}
