package io.entityjdbc;

import java.sql.SQLException;

import org.postgresql.util.PSQLState;

/**
 * Base SQL exception type raised by this library.
 */
public class EntityJdbcException extends SQLException {
    public EntityJdbcException(String msg, PSQLState state) {
        super(msg, state == null ? null : state.getState());
    }

    public EntityJdbcException(String msg,
                               PSQLState state,
                               Throwable cause) {
        super(msg, state == null ? null : state.getState(), cause);
    }

    public EntityJdbcException(String msg, Throwable cause) {
        super(msg, sqlStateOf(cause), cause);
    }

    private static String sqlStateOf(Throwable cause) {
        return cause instanceof SQLException ? ((SQLException) cause).getSQLState() : null;
    }
}
