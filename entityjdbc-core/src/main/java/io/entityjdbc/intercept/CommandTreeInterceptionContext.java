package io.entityjdbc.intercept;

import java.util.Collection;

import io.entityjdbc.util.Assert;

/**
 * Context of a command tree creation event. Interceptors may replace the tree through
 * {@link #setResult(CommandTree)}.
 */
public class CommandTreeInterceptionContext extends AbstractInterceptionContext<CommandTreeInterceptionContext> {
    private final CommandTree originalResult;

    private CommandTree result;

    public CommandTreeInterceptionContext(AbstractInterceptionContext<?> copyFrom, CommandTree commandTree) {
        super(copyFrom);
        Assert.notNull(commandTree, "commandTree is null");
        this.originalResult = commandTree;
        this.result = commandTree;
    }

    protected CommandTreeInterceptionContext(Collection<? extends Session> sessions,
                                             boolean async,
                                             CommandTree originalResult,
                                             CommandTree result) {
        super(sessions, async);
        this.originalResult = originalResult;
        this.result = result;
    }

    public CommandTree getOriginalResult() {
        return originalResult;
    }

    public CommandTree getResult() {
        return result;
    }

    public void setResult(CommandTree result) {
        Assert.notNull(result, "result is null");
        this.result = result;
    }

    @Override
    protected CommandTreeInterceptionContext copy(Collection<? extends Session> sessions, boolean async) {
        return new CommandTreeInterceptionContext(sessions, async, originalResult, result);
    }
}
