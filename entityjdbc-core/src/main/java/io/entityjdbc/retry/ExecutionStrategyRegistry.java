package io.entityjdbc.retry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.entityjdbc.util.Assert;

/**
 * Thread-safe registry of execution strategy factories. Lookup falls back from the exact key
 * to the provider with any server, and finally to {@link DefaultExecutionStrategy}.
 */
public class ExecutionStrategyRegistry {
    public static final String ANY_SERVER = "*";

    private static final Logger logger = LoggerFactory.getLogger(ExecutionStrategyRegistry.class);

    private final Map<ExecutionStrategyKey, Supplier<? extends ExecutionStrategy>> factories
            = new ConcurrentHashMap<>();

    public void register(String providerInvariantName, Supplier<? extends ExecutionStrategy> factory) {
        register(new ExecutionStrategyKey(providerInvariantName, ANY_SERVER), factory);
    }

    public void register(ExecutionStrategyKey key, Supplier<? extends ExecutionStrategy> factory) {
        Assert.notNull(key, "key is null");
        Assert.notNull(factory, "factory is null");
        if (factories.put(key, factory) != null) {
            logger.debug("Replaced execution strategy factory for [{}]", key);
        }
    }

    public boolean unregister(ExecutionStrategyKey key) {
        Assert.notNull(key, "key is null");
        return factories.remove(key) != null;
    }

    /**
     * Create the execution strategy for the given provider and server. The factory is invoked
     * on every call.
     *
     * @param providerInvariantName the provider name
     * @param serverName the server name
     * @return the strategy, never null
     */
    public ExecutionStrategy resolve(String providerInvariantName, String serverName) {
        Supplier<? extends ExecutionStrategy> factory
                = factories.get(new ExecutionStrategyKey(providerInvariantName, serverName));
        if (factory == null) {
            factory = factories.get(new ExecutionStrategyKey(providerInvariantName, ANY_SERVER));
        }
        if (factory == null) {
            return DefaultExecutionStrategy.INSTANCE;
        }
        ExecutionStrategy strategy = factory.get();
        Assert.state(strategy != null, "Execution strategy factory for ["
                + providerInvariantName + "@" + serverName + "] returned null");
        return strategy;
    }
}
