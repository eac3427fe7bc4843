package io.entityjdbc.intercept;

/**
 * Marker for all interceptors. An interceptor is registered with {@link Interception} or a
 * {@link Dispatchers} instance and receives the events of every capability interface it
 * implements.
 *
 * @see CommandInterceptor
 * @see CommandTreeInterceptor
 * @see ConnectionInterceptor
 * @see CancelableCommandInterceptor
 */
public interface DbInterceptor {
}
