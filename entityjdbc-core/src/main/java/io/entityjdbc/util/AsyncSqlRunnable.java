package io.entityjdbc.util;

import java.sql.SQLException;
import java.util.concurrent.CompletionStage;

/**
 * An asynchronous database operation without a result.
 */
@FunctionalInterface
public interface AsyncSqlRunnable {
    CompletionStage<?> start() throws SQLException;
}
