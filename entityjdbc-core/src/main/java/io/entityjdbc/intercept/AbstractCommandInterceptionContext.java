package io.entityjdbc.intercept;

import java.util.Collection;

import io.entityjdbc.util.Assert;

/**
 * Base class of contexts for command execution events, adding the command behavior.
 *
 * @param <C> the concrete context type
 */
public abstract class AbstractCommandInterceptionContext<C extends AbstractCommandInterceptionContext<C>>
        extends AbstractInterceptionContext<C> {
    private final CommandBehavior commandBehavior;

    protected AbstractCommandInterceptionContext() {
        this.commandBehavior = CommandBehavior.DEFAULT;
    }

    /**
     * Copy sessions and async flag from any context, and the command behavior if the source is
     * a command context.
     */
    protected AbstractCommandInterceptionContext(AbstractInterceptionContext<?> copyFrom) {
        super(copyFrom);
        this.commandBehavior = copyFrom instanceof AbstractCommandInterceptionContext
                ? ((AbstractCommandInterceptionContext<?>) copyFrom).commandBehavior
                : CommandBehavior.DEFAULT;
    }

    protected AbstractCommandInterceptionContext(Collection<? extends Session> sessions,
                                                 boolean async,
                                                 CommandBehavior commandBehavior) {
        super(sessions, async);
        Assert.notNull(commandBehavior, "commandBehavior is null");
        this.commandBehavior = commandBehavior;
    }

    public CommandBehavior getCommandBehavior() {
        return commandBehavior;
    }

    public C withCommandBehavior(CommandBehavior commandBehavior) {
        Assert.notNull(commandBehavior, "commandBehavior is null");
        return copy(getSessions(), isAsync(), commandBehavior);
    }

    @Override
    protected final C copy(Collection<? extends Session> sessions, boolean async) {
        return copy(sessions, async, commandBehavior);
    }

    protected abstract C copy(Collection<? extends Session> sessions, boolean async, CommandBehavior commandBehavior);
}
