package io.entityjdbc.intercept;

import io.entityjdbc.util.Assert;

/**
 * Dispatches the execution veto to the registered {@link CancelableCommandInterceptor}s.
 */
public class CancelableCommandDispatcher {
    private final InternalDispatcher<CancelableCommandInterceptor> internalDispatcher
            = new InternalDispatcher<>(CancelableCommandInterceptor.class);

    public InternalDispatcher<CancelableCommandInterceptor> getInternalDispatcher() {
        return internalDispatcher;
    }

    /**
     * Ask every interceptor whether the command may execute. All interceptors are asked even
     * after one of them vetoed.
     *
     * @return true if no interceptor vetoed the command
     */
    public boolean executing(DbCommand command, InterceptionContext context) {
        Assert.notNull(command, "command is null");
        Assert.notNull(context, "context is null");
        return internalDispatcher.dispatch(true,
                (proceed, interceptor) -> interceptor.commandExecuting(command, context) && proceed);
    }
}
