package io.entityjdbc;

/**
 * Raised when saving tracked changes to the database fails. The actual cause is the
 * wrapped exception, typically an {@link UpdateException}.
 */
public class DbUpdateException extends EntityJdbcException {
    public DbUpdateException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
