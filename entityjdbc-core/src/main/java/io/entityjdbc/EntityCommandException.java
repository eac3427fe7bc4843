package io.entityjdbc;

/**
 * Wraps a failure raised by the underlying data provider while executing a command or
 * opening a connection. The actual cause is always the wrapped exception.
 */
public class EntityCommandException extends EntityJdbcException {
    public EntityCommandException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
