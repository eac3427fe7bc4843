package io.entityjdbc.intercept;

/**
 * Interceptor receiving command trees before they are turned into statements.
 */
@FunctionalInterface
public interface CommandTreeInterceptor extends DbInterceptor {
    void treeCreated(CommandTreeInterceptionContext context);
}
