package io.entityjdbc.intercept;

import io.entityjdbc.util.Assert;

/**
 * Dispatches command tree creation to the registered {@link CommandTreeInterceptor}s.
 */
public class CommandTreeDispatcher {
    private final InternalDispatcher<CommandTreeInterceptor> internalDispatcher
            = new InternalDispatcher<>(CommandTreeInterceptor.class);

    public InternalDispatcher<CommandTreeInterceptor> getInternalDispatcher() {
        return internalDispatcher;
    }

    /**
     * @param commandTree the tree just created
     * @param context the ambient context
     * @return the tree to use, possibly replaced by an interceptor
     */
    public CommandTree created(CommandTree commandTree, InterceptionContext context) {
        Assert.notNull(commandTree, "commandTree is null");
        Assert.notNull(context, "context is null");

        if (internalDispatcher.isEmpty()) {
            return commandTree;
        }

        CommandTreeInterceptionContext treeContext = new CommandTreeInterceptionContext(context, commandTree);
        internalDispatcher.dispatch(interceptor -> interceptor.treeCreated(treeContext));
        return treeContext.getResult();
    }
}
