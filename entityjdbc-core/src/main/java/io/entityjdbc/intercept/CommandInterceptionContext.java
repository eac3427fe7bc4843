package io.entityjdbc.intercept;

import java.util.Collection;

/**
 * Context passed by callers to the {@link CommandDispatcher}. The dispatcher derives a
 * {@link CommandExecutionContext} from it for each execution.
 */
public class CommandInterceptionContext extends AbstractCommandInterceptionContext<CommandInterceptionContext> {
    public CommandInterceptionContext() {
    }

    public CommandInterceptionContext(AbstractInterceptionContext<?> copyFrom) {
        super(copyFrom);
    }

    protected CommandInterceptionContext(Collection<? extends Session> sessions,
                                         boolean async,
                                         CommandBehavior commandBehavior) {
        super(sessions, async, commandBehavior);
    }

    @Override
    protected CommandInterceptionContext copy(Collection<? extends Session> sessions,
                                              boolean async,
                                              CommandBehavior commandBehavior) {
        return new CommandInterceptionContext(sessions, async, commandBehavior);
    }

    @Override
    public String toString() {
        return "CommandInterceptionContext{" +
                "sessions=" + getSessions().size() +
                ", async=" + isAsync() +
                ", commandBehavior=" + getCommandBehavior() +
                '}';
    }
}
