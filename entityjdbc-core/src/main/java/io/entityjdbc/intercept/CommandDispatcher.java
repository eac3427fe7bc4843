package io.entityjdbc.intercept;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;

import io.entityjdbc.util.Assert;
import io.entityjdbc.util.AsyncSqlCallable;
import io.entityjdbc.util.SqlCallable;

/**
 * Dispatches command executions to the registered {@link CommandInterceptor}s. Each call
 * derives a fresh {@link CommandExecutionContext} from the caller's context, so the caller's
 * context never carries results.
 */
public class CommandDispatcher {
    private final InternalDispatcher<CommandInterceptor> internalDispatcher
            = new InternalDispatcher<>(CommandInterceptor.class);

    public InternalDispatcher<CommandInterceptor> getInternalDispatcher() {
        return internalDispatcher;
    }

    public long nonQuery(DbCommand command, SqlCallable<Long> operation, CommandInterceptionContext context)
            throws SQLException {
        Assert.notNull(command, "command is null");
        Long result = internalDispatcher.dispatch(operation, CommandDispatcher.<Long>newContext(context),
                (interceptor, c) -> interceptor.nonQueryExecuting(command, c),
                (interceptor, c) -> interceptor.nonQueryExecuted(command, c));
        Assert.state(result != null, "No row count available for command");
        return result;
    }

    public ResultSet reader(DbCommand command, SqlCallable<ResultSet> operation, CommandInterceptionContext context)
            throws SQLException {
        Assert.notNull(command, "command is null");
        return internalDispatcher.dispatch(operation, CommandDispatcher.<ResultSet>newContext(context),
                (interceptor, c) -> interceptor.readerExecuting(command, c),
                (interceptor, c) -> interceptor.readerExecuted(command, c));
    }

    public Object scalar(DbCommand command, SqlCallable<Object> operation, CommandInterceptionContext context)
            throws SQLException {
        Assert.notNull(command, "command is null");
        return internalDispatcher.dispatch(operation, CommandDispatcher.<Object>newContext(context),
                (interceptor, c) -> interceptor.scalarExecuting(command, c),
                (interceptor, c) -> interceptor.scalarExecuted(command, c));
    }

    public boolean execute(DbCommand command, SqlCallable<Boolean> operation, CommandInterceptionContext context)
            throws SQLException {
        Assert.notNull(command, "command is null");
        Boolean result = internalDispatcher.dispatch(operation, CommandDispatcher.<Boolean>newContext(context),
                (interceptor, c) -> interceptor.executeExecuting(command, c),
                (interceptor, c) -> interceptor.executeExecuted(command, c));
        Assert.state(result != null, "No execution result available for command");
        return result;
    }

    public CompletableFuture<Long> nonQueryAsync(DbCommand command,
                                                 AsyncSqlCallable<Long> operation,
                                                 CommandInterceptionContext context) {
        Assert.notNull(command, "command is null");
        return internalDispatcher.dispatchAsync(operation, CommandDispatcher.<Long>newAsyncContext(context),
                (interceptor, c) -> interceptor.nonQueryExecuting(command, c),
                (interceptor, c) -> interceptor.nonQueryExecuted(command, c));
    }

    public CompletableFuture<ResultSet> readerAsync(DbCommand command,
                                                    AsyncSqlCallable<ResultSet> operation,
                                                    CommandInterceptionContext context) {
        Assert.notNull(command, "command is null");
        return internalDispatcher.dispatchAsync(operation, CommandDispatcher.<ResultSet>newAsyncContext(context),
                (interceptor, c) -> interceptor.readerExecuting(command, c),
                (interceptor, c) -> interceptor.readerExecuted(command, c));
    }

    public CompletableFuture<Object> scalarAsync(DbCommand command,
                                                 AsyncSqlCallable<Object> operation,
                                                 CommandInterceptionContext context) {
        Assert.notNull(command, "command is null");
        return internalDispatcher.dispatchAsync(operation, CommandDispatcher.<Object>newAsyncContext(context),
                (interceptor, c) -> interceptor.scalarExecuting(command, c),
                (interceptor, c) -> interceptor.scalarExecuted(command, c));
    }

    public CompletableFuture<Boolean> executeAsync(DbCommand command,
                                                   AsyncSqlCallable<Boolean> operation,
                                                   CommandInterceptionContext context) {
        Assert.notNull(command, "command is null");
        return internalDispatcher.dispatchAsync(operation, CommandDispatcher.<Boolean>newAsyncContext(context),
                (interceptor, c) -> interceptor.executeExecuting(command, c),
                (interceptor, c) -> interceptor.executeExecuted(command, c));
    }

    private static <R> CommandExecutionContext<R> newContext(CommandInterceptionContext context) {
        Assert.notNull(context, "context is null");
        return new CommandExecutionContext<>(context);
    }

    private static <R> CommandExecutionContext<R> newAsyncContext(CommandInterceptionContext context) {
        CommandExecutionContext<R> executionContext = newContext(context);
        return executionContext.asAsync();
    }
}
