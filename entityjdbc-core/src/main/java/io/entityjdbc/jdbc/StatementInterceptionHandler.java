package io.entityjdbc.jdbc;

import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Map;
import java.util.TreeMap;

import io.entityjdbc.intercept.CommandCanceledException;
import io.entityjdbc.intercept.CommandInterceptionContext;
import io.entityjdbc.intercept.DbCommand;
import io.entityjdbc.intercept.Dispatchers;
import io.entityjdbc.intercept.InterceptionContext;
import io.entityjdbc.intercept.SqlCommandTree;

/**
 * Routes the execute methods of a statement through the cancelable command dispatcher and
 * then the command dispatcher. Parameters bound through the indexed setters are tracked and
 * exposed to interceptors with the command.
 */
public class StatementInterceptionHandler extends AbstractInterceptionHandler<Statement> {
    public static <S extends Statement> S proxy(S delegate,
                                                Class<S> statementType,
                                                String preparedCommandText,
                                                Connection connection,
                                                Dispatchers dispatchers,
                                                CommandInterceptionContext context) {
        return statementType.cast(Proxy.newProxyInstance(
                StatementInterceptionHandler.class.getClassLoader(),
                new Class[] {statementType},
                new StatementInterceptionHandler(delegate, preparedCommandText, connection, dispatchers, context)));
    }

    private final String preparedCommandText;

    private final Connection connection;

    private final CommandInterceptionContext context;

    private final Map<Integer, Object> parameters = new TreeMap<>();

    protected StatementInterceptionHandler(Statement delegate,
                                           String preparedCommandText,
                                           Connection connection,
                                           Dispatchers dispatchers,
                                           CommandInterceptionContext context) {
        super(delegate, dispatchers);
        this.preparedCommandText = preparedCommandText;
        this.connection = connection;
        this.context = context;
    }

    @Override
    protected Object doInvoke(Object proxy, Method method, Object[] args) throws Throwable {
        String name = method.getName();

        if (name.startsWith("set") && args.length >= 2 && args[0] instanceof Integer) {
            parameters.put((Integer) args[0], args[1]);
            return proceed(method, args);
        }

        switch (name) {
            case "clearParameters":
                parameters.clear();
                return proceed(method, args);
            case "getConnection":
                return connection;
            case "executeQuery": {
                Object[] commandArgs = rewriteCommandText(args);
                DbCommand command = newCommand(proxy, commandArgs);
                return getDispatchers().getCommand().reader(command,
                        () -> (ResultSet) proceed(method, commandArgs), context);
            }
            case "executeUpdate": {
                Object[] commandArgs = rewriteCommandText(args);
                DbCommand command = newCommand(proxy, commandArgs);
                long rows = getDispatchers().getCommand().nonQuery(command,
                        () -> ((Integer) proceed(method, commandArgs)).longValue(), context);
                return Math.toIntExact(rows);
            }
            case "executeLargeUpdate": {
                Object[] commandArgs = rewriteCommandText(args);
                DbCommand command = newCommand(proxy, commandArgs);
                return getDispatchers().getCommand().nonQuery(command,
                        () -> (Long) proceed(method, commandArgs), context);
            }
            case "execute": {
                Object[] commandArgs = rewriteCommandText(args);
                DbCommand command = newCommand(proxy, commandArgs);
                return getDispatchers().getCommand().execute(command,
                        () -> (Boolean) proceed(method, commandArgs), context);
            }
            default:
                return proceed(method, args);
        }
    }

    /**
     * Plain statements take the SQL as first argument, which goes through the command tree
     * dispatcher before execution.
     */
    private Object[] rewriteCommandText(Object[] args) {
        if (args.length == 0 || !(args[0] instanceof String)) {
            return args;
        }
        Object[] copy = args.clone();
        copy[0] = getDispatchers().getCommandTree()
                .created(new SqlCommandTree((String) args[0]), new InterceptionContext(context))
                .getCommandText();
        return copy;
    }

    private DbCommand newCommand(Object proxy, Object[] args) throws CommandCanceledException {
        String commandText = args.length > 0 && args[0] instanceof String
                ? (String) args[0]
                : preparedCommandText;

        DbCommand command = new DbCommand((Statement) proxy,
                commandText != null ? commandText : "", parameters);

        if (!getDispatchers().getCancelableCommand().executing(command, new InterceptionContext(context))) {
            throw new CommandCanceledException("Command execution canceled by interceptor: " + commandText);
        }

        return command;
    }
}
