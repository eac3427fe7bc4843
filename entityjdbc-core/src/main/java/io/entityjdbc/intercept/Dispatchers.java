package io.entityjdbc.intercept;

import io.entityjdbc.util.Assert;

/**
 * Dispatchers of all interceptor capabilities. An interceptor is registered with the
 * dispatcher of every capability it implements.
 */
public class Dispatchers {
    private final CommandDispatcher command = new CommandDispatcher();

    private final CommandTreeDispatcher commandTree = new CommandTreeDispatcher();

    private final ConnectionDispatcher connection = new ConnectionDispatcher();

    private final CancelableCommandDispatcher cancelableCommand = new CancelableCommandDispatcher();

    public void addInterceptor(DbInterceptor interceptor) {
        Assert.notNull(interceptor, "interceptor is null");
        command.getInternalDispatcher().add(interceptor);
        commandTree.getInternalDispatcher().add(interceptor);
        connection.getInternalDispatcher().add(interceptor);
        cancelableCommand.getInternalDispatcher().add(interceptor);
    }

    public void removeInterceptor(DbInterceptor interceptor) {
        Assert.notNull(interceptor, "interceptor is null");
        command.getInternalDispatcher().remove(interceptor);
        commandTree.getInternalDispatcher().remove(interceptor);
        connection.getInternalDispatcher().remove(interceptor);
        cancelableCommand.getInternalDispatcher().remove(interceptor);
    }

    public CommandDispatcher getCommand() {
        return command;
    }

    public CommandTreeDispatcher getCommandTree() {
        return commandTree;
    }

    public ConnectionDispatcher getConnection() {
        return connection;
    }

    public CancelableCommandDispatcher getCancelableCommand() {
        return cancelableCommand;
    }
}
