package io.entityjdbc.intercept;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.BiConsumer;

import io.entityjdbc.util.Assert;
import io.entityjdbc.util.SqlCallable;
import io.entityjdbc.util.SqlRunnable;

/**
 * Dispatches connection operations to the registered {@link ConnectionInterceptor}s.
 */
public class ConnectionDispatcher {
    private final InternalDispatcher<ConnectionInterceptor> internalDispatcher
            = new InternalDispatcher<>(ConnectionInterceptor.class);

    public InternalDispatcher<ConnectionInterceptor> getInternalDispatcher() {
        return internalDispatcher;
    }

    public Connection open(SqlCallable<Connection> operation, InterceptionContext context) throws SQLException {
        Assert.notNull(context, "context is null");
        return internalDispatcher.dispatch(operation, new ConnectionInterceptionContext<Connection>(context),
                ConnectionInterceptor::opening,
                ConnectionInterceptor::opened);
    }

    public void close(Connection connection, InterceptionContext context) throws SQLException {
        dispatch(connection, connection::close, context,
                (interceptor, c) -> interceptor.closing(connection, c),
                (interceptor, c) -> interceptor.closed(connection, c));
    }

    public void commit(Connection connection, InterceptionContext context) throws SQLException {
        dispatch(connection, connection::commit, context,
                (interceptor, c) -> interceptor.committing(connection, c),
                (interceptor, c) -> interceptor.committed(connection, c));
    }

    public void rollback(Connection connection, InterceptionContext context) throws SQLException {
        dispatch(connection, connection::rollback, context,
                (interceptor, c) -> interceptor.rollingBack(connection, c),
                (interceptor, c) -> interceptor.rolledBack(connection, c));
    }

    private void dispatch(Connection connection,
                          SqlRunnable operation,
                          InterceptionContext context,
                          BiConsumer<ConnectionInterceptor, ConnectionInterceptionContext<Void>> executing,
                          BiConsumer<ConnectionInterceptor, ConnectionInterceptionContext<Void>> executed)
            throws SQLException {
        Assert.notNull(connection, "connection is null");
        Assert.notNull(context, "context is null");
        internalDispatcher.dispatch(() -> {
            operation.run();
            return null;
        }, new ConnectionInterceptionContext<Void>(context), executing, executed);
    }
}
