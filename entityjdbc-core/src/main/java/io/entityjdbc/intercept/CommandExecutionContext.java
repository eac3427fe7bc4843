package io.entityjdbc.intercept;

import java.util.Collection;

import io.entityjdbc.util.Assert;

/**
 * Context of a single command execution created by the {@link CommandDispatcher}. Copies
 * start with fresh mutable data.
 *
 * @param <R> the command result type
 */
public class CommandExecutionContext<R> extends AbstractCommandInterceptionContext<CommandExecutionContext<R>>
        implements MutableInterceptionContext<R> {
    private final InterceptionContextMutableData<R> mutableData = new InterceptionContextMutableData<>();

    public CommandExecutionContext() {
    }

    public CommandExecutionContext(AbstractInterceptionContext<?> copyFrom) {
        super(copyFrom);
    }

    protected CommandExecutionContext(Collection<? extends Session> sessions,
                                      boolean async,
                                      CommandBehavior commandBehavior) {
        super(sessions, async, commandBehavior);
    }

    @Override
    public InterceptionContextMutableData<R> getMutableData() {
        return mutableData;
    }

    /**
     * @param exception the exception to pre-set
     * @return a copy whose execution is suppressed by the given exception
     */
    public CommandExecutionContext<R> withException(Throwable exception) {
        Assert.notNull(exception, "exception is null");
        CommandExecutionContext<R> copy = copy(getSessions(), isAsync(), getCommandBehavior());
        copy.setException(exception);
        return copy;
    }

    @Override
    protected CommandExecutionContext<R> copy(Collection<? extends Session> sessions,
                                              boolean async,
                                              CommandBehavior commandBehavior) {
        return new CommandExecutionContext<>(sessions, async, commandBehavior);
    }

    @Override
    public String toString() {
        return "CommandExecutionContext{" +
                "sessions=" + getSessions().size() +
                ", async=" + isAsync() +
                ", commandBehavior=" + getCommandBehavior() +
                ", mutableData=" + mutableData +
                '}';
    }
}
