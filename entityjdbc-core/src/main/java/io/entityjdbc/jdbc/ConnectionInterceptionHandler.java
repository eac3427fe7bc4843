package io.entityjdbc.jdbc;

import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;

import io.entityjdbc.intercept.CommandInterceptionContext;
import io.entityjdbc.intercept.Dispatchers;
import io.entityjdbc.intercept.InterceptionContext;
import io.entityjdbc.intercept.SqlCommandTree;

/**
 * Routes transaction completion and close of a connection through the connection dispatcher
 * and wraps the statements it creates. SQL passed to {@code prepareStatement} and
 * {@code prepareCall} goes through the command tree dispatcher first.
 */
public class ConnectionInterceptionHandler extends AbstractInterceptionHandler<Connection> {
    public static Connection proxy(Connection delegate, Dispatchers dispatchers, InterceptionContext context) {
        return (Connection) Proxy.newProxyInstance(
                ConnectionInterceptionHandler.class.getClassLoader(),
                new Class[] {Connection.class},
                new ConnectionInterceptionHandler(delegate, dispatchers, context));
    }

    private final InterceptionContext context;

    protected ConnectionInterceptionHandler(Connection delegate, Dispatchers dispatchers,
                                            InterceptionContext context) {
        super(delegate, dispatchers);
        this.context = context;
    }

    public InterceptionContext getContext() {
        return context;
    }

    @Override
    protected Object doInvoke(Object proxy, Method method, Object[] args) throws Throwable {
        String name = method.getName();

        if (args.length == 0) {
            switch (name) {
                case "commit":
                    getDispatchers().getConnection().commit(getDelegate(), context);
                    return null;
                case "rollback":
                    getDispatchers().getConnection().rollback(getDelegate(), context);
                    return null;
                case "close":
                    getDispatchers().getConnection().close(getDelegate(), context);
                    return null;
                default:
                    break;
            }
        }

        switch (name) {
            case "createStatement": {
                Statement statement = (Statement) proceed(method, args);
                return StatementInterceptionHandler.proxy(statement, Statement.class, null,
                        (Connection) proxy, getDispatchers(), new CommandInterceptionContext(context));
            }
            case "prepareStatement": {
                Object[] rewrittenArgs = rewriteCommandText(args);
                PreparedStatement statement = (PreparedStatement) proceed(method, rewrittenArgs);
                return StatementInterceptionHandler.proxy(statement, PreparedStatement.class,
                        (String) rewrittenArgs[0], (Connection) proxy,
                        getDispatchers(), new CommandInterceptionContext(context));
            }
            case "prepareCall": {
                Object[] rewrittenArgs = rewriteCommandText(args);
                CallableStatement statement = (CallableStatement) proceed(method, rewrittenArgs);
                return StatementInterceptionHandler.proxy(statement, CallableStatement.class,
                        (String) rewrittenArgs[0], (Connection) proxy,
                        getDispatchers(), new CommandInterceptionContext(context));
            }
            default:
                return proceed(method, args);
        }
    }

    private Object[] rewriteCommandText(Object[] args) {
        Object[] copy = args.clone();
        copy[0] = getDispatchers().getCommandTree()
                .created(new SqlCommandTree((String) args[0]), context)
                .getCommandText();
        return copy;
    }
}
