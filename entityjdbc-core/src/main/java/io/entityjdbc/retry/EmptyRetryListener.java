package io.entityjdbc.retry;

import java.util.Properties;

/**
 * A no-op retry listener.
 */
public class EmptyRetryListener implements RetryListener {
    public static final EmptyRetryListener INSTANCE = new EmptyRetryListener();

    @Override
    public void configure(Properties properties) {
    }
}
