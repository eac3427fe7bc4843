package io.entityjdbc.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work run by {@link TransactionTemplate} on a transactional connection.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ConnectionCallback<T> {
    T doInConnection(Connection connection) throws SQLException;
}
