package io.entityjdbc;

/**
 * Raised by the update pipeline when a modification command fails.
 */
public class UpdateException extends EntityJdbcException {
    public UpdateException(String msg) {
        super(msg, (Throwable) null);
    }

    public UpdateException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
