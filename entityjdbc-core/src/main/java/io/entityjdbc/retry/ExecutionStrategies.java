package io.entityjdbc.retry;

import java.lang.reflect.InvocationTargetException;
import java.util.Properties;

import io.entityjdbc.EntityJdbcProperty;
import io.entityjdbc.InvalidConfigurationException;

/**
 * Factory methods for execution strategies.
 */
public abstract class ExecutionStrategies {
    /**
     * Create an execution strategy from configuration properties. The strategy and retry
     * listener classes are loaded by name and must have a public no-arg constructor.
     *
     * @param properties the configuration properties, see {@link EntityJdbcProperty}
     * @return a new, configured strategy
     * @throws InvalidConfigurationException if a class cannot be loaded or has the wrong type
     */
    public static ExecutionStrategy fromProperties(Properties properties) throws InvalidConfigurationException {
        ExecutionStrategy strategy = newInstance(
                EntityJdbcProperty.EXECUTION_STRATEGY_CLASSNAME.getValue(properties), ExecutionStrategy.class);

        if (strategy instanceof SqlStateExecutionStrategy) {
            ((SqlStateExecutionStrategy) strategy).configure(properties);
        }

        if (strategy instanceof AbstractExecutionStrategy) {
            RetryListener retryListener = newInstance(
                    EntityJdbcProperty.RETRY_LISTENER_CLASSNAME.getValue(properties), RetryListener.class);
            retryListener.configure(properties);
            ((AbstractExecutionStrategy) strategy).setRetryListener(retryListener);
        }

        return strategy;
    }

    private static <T> T newInstance(String className, Class<T> type) throws InvalidConfigurationException {
        try {
            Object instance = Class.forName(className).getDeclaredConstructor().newInstance();
            if (!type.isInstance(instance)) {
                throw new InvalidConfigurationException("Class [" + className
                        + "] does not implement [" + type.getName() + "]");
            }
            return type.cast(instance);
        } catch (ClassNotFoundException | InstantiationException | IllegalAccessException
                 | NoSuchMethodException | InvocationTargetException e) {
            throw new InvalidConfigurationException("Unable to create instance of class [" + className + "]", e);
        }
    }
}
