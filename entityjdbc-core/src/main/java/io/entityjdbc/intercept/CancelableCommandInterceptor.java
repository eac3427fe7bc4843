package io.entityjdbc.intercept;

/**
 * Interceptor deciding whether a command may execute at all.
 */
@FunctionalInterface
public interface CancelableCommandInterceptor extends DbInterceptor {
    /**
     * @param command the command about to execute
     * @param context the ambient context
     * @return false to cancel the command
     */
    boolean commandExecuting(DbCommand command, InterceptionContext context);
}
