package io.entityjdbc.intercept;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import io.entityjdbc.util.Assert;

/**
 * Interception context carrying no event specific state.
 */
public class InterceptionContext extends AbstractInterceptionContext<InterceptionContext> {
    public static final InterceptionContext EMPTY = new InterceptionContext();

    /**
     * Combine contexts into one associated with the open sessions of all of them. The result
     * is asynchronous if any of the contexts is.
     *
     * @param contexts the contexts to combine
     * @return a new context
     */
    public static InterceptionContext combine(Collection<? extends AbstractInterceptionContext<?>> contexts) {
        Assert.notNull(contexts, "contexts is null");
        List<Session> sessions = new ArrayList<>();
        boolean async = false;
        for (AbstractInterceptionContext<?> context : contexts) {
            Assert.notNull(context, "context is null");
            sessions.addAll(context.getSessions());
            async |= context.isAsync();
        }
        return new InterceptionContext(sessions, async);
    }

    public static InterceptionContext combine(AbstractInterceptionContext<?>... contexts) {
        return combine(Arrays.asList(contexts));
    }

    public InterceptionContext() {
    }

    public InterceptionContext(AbstractInterceptionContext<?> copyFrom) {
        super(copyFrom);
    }

    protected InterceptionContext(Collection<? extends Session> sessions, boolean async) {
        super(sessions, async);
    }

    @Override
    protected InterceptionContext copy(Collection<? extends Session> sessions, boolean async) {
        return new InterceptionContext(sessions, async);
    }
}
