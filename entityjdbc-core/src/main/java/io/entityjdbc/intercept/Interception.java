package io.entityjdbc.intercept;

/**
 * Process-wide registration of interceptors. Registration takes effect immediately for all
 * subsequent dispatches.
 */
public abstract class Interception {
    private static final Dispatchers DISPATCH = new Dispatchers();

    public static void addInterceptor(DbInterceptor interceptor) {
        DISPATCH.addInterceptor(interceptor);
    }

    /**
     * Unregister the interceptor. No-op if it is not registered.
     */
    public static void removeInterceptor(DbInterceptor interceptor) {
        DISPATCH.removeInterceptor(interceptor);
    }

    public static Dispatchers getDispatch() {
        return DISPATCH;
    }
}
