package io.entityjdbc.intercept;

import java.sql.ResultSet;

/**
 * Interceptor for command execution. Each kind of execution has an executing hook, invoked
 * before the command runs, and an executed hook, invoked after it completed or failed.
 *
 * <p>An executing hook may set a result or an exception on the context to suppress the
 * command. An executed hook may replace the result or exception. Setting the exception to
 * null and a result swallows a failure.
 */
@SuppressWarnings("EmptyMethod")
public interface CommandInterceptor extends DbInterceptor {
    /**
     * Invoked before an update returning a row count, like {@code executeUpdate}.
     */
    default void nonQueryExecuting(DbCommand command, CommandExecutionContext<Long> context) {
    }

    default void nonQueryExecuted(DbCommand command, CommandExecutionContext<Long> context) {
    }

    /**
     * Invoked before a query returning a result set, like {@code executeQuery}.
     */
    default void readerExecuting(DbCommand command, CommandExecutionContext<ResultSet> context) {
    }

    default void readerExecuted(DbCommand command, CommandExecutionContext<ResultSet> context) {
    }

    /**
     * Invoked before a query returning a single value.
     */
    default void scalarExecuting(DbCommand command, CommandExecutionContext<Object> context) {
    }

    default void scalarExecuted(DbCommand command, CommandExecutionContext<Object> context) {
    }

    /**
     * Invoked before {@code execute}, whose result tells whether the first result is a result set.
     */
    default void executeExecuting(DbCommand command, CommandExecutionContext<Boolean> context) {
    }

    default void executeExecuted(DbCommand command, CommandExecutionContext<Boolean> context) {
    }
}
