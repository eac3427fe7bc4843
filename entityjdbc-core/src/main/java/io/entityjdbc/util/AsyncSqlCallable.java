package io.entityjdbc.util;

import java.sql.SQLException;
import java.util.concurrent.CompletionStage;

/**
 * An asynchronous database operation. Starting the operation may fail synchronously with an
 * SQLException, or the returned stage may complete exceptionally.
 *
 * @param <T> type of result
 */
@FunctionalInterface
public interface AsyncSqlCallable<T> {
    CompletionStage<T> start() throws SQLException;
}
