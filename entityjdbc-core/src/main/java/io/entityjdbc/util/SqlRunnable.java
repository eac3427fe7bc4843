package io.entityjdbc.util;

import java.sql.SQLException;

/**
 * A database operation without a result, which may throw SQLExceptions.
 */
@FunctionalInterface
public interface SqlRunnable {
    void run() throws SQLException;
}
