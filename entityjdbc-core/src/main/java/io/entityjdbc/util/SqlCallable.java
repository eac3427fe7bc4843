package io.entityjdbc.util;

import java.sql.SQLException;

/**
 * A database operation producing a result, which may throw SQLExceptions.
 *
 * @param <T> type of result
 */
@FunctionalInterface
public interface SqlCallable<T> {
    /**
     * Runs the operation.
     *
     * @return the operation result
     * @throws SQLException on any SQL exception
     */
    T call() throws SQLException;
}
