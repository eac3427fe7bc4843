package io.entityjdbc;

import org.postgresql.util.PSQLState;

public class InvalidConfigurationException extends NonTransientEntityJdbcException {
    public InvalidConfigurationException(String msg) {
        super(msg, PSQLState.UNEXPECTED_ERROR);
    }

    public InvalidConfigurationException(String msg, Throwable cause) {
        super(msg, PSQLState.UNEXPECTED_ERROR, cause);
    }
}
