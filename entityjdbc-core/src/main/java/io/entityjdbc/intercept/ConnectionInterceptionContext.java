package io.entityjdbc.intercept;

import java.util.Collection;

/**
 * Context of a connection operation created by the {@link ConnectionDispatcher}.
 *
 * @param <R> the operation result type, {@link Void} for operations without result
 */
public class ConnectionInterceptionContext<R> extends AbstractInterceptionContext<ConnectionInterceptionContext<R>>
        implements MutableInterceptionContext<R> {
    private final InterceptionContextMutableData<R> mutableData = new InterceptionContextMutableData<>();

    public ConnectionInterceptionContext() {
    }

    public ConnectionInterceptionContext(AbstractInterceptionContext<?> copyFrom) {
        super(copyFrom);
    }

    protected ConnectionInterceptionContext(Collection<? extends Session> sessions, boolean async) {
        super(sessions, async);
    }

    @Override
    public InterceptionContextMutableData<R> getMutableData() {
        return mutableData;
    }

    @Override
    protected ConnectionInterceptionContext<R> copy(Collection<? extends Session> sessions, boolean async) {
        return new ConnectionInterceptionContext<>(sessions, async);
    }
}
