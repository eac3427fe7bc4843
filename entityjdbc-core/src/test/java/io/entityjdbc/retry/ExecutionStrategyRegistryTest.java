package io.entityjdbc.retry;

import java.time.Duration;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit-test")
public class ExecutionStrategyRegistryTest {
    private static final String PROVIDER = "org.postgresql.Driver";

    @Test
    public void whenKeysCompared_expectOrdinalEquality() {
        Assertions.assertEquals(new ExecutionStrategyKey(PROVIDER, "db1"), new ExecutionStrategyKey(PROVIDER, "db1"));
        Assertions.assertEquals(new ExecutionStrategyKey(PROVIDER, "db1").hashCode(),
                new ExecutionStrategyKey(PROVIDER, "db1").hashCode());
        Assertions.assertNotEquals(new ExecutionStrategyKey(PROVIDER, "db1"), new ExecutionStrategyKey(PROVIDER, "DB1"));
        Assertions.assertNotEquals(new ExecutionStrategyKey(PROVIDER, "db1"), new ExecutionStrategyKey("other", "db1"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ExecutionStrategyKey("", "db1"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ExecutionStrategyKey(PROVIDER, null));
    }

    @Test
    public void whenResolving_expectExactThenProviderThenDefault() {
        ExecutionStrategyRegistry registry = new ExecutionStrategyRegistry();
        registry.register(new ExecutionStrategyKey(PROVIDER, "db1"),
                () -> new SqlStateExecutionStrategy(7, Duration.ofSeconds(1)));
        registry.register(PROVIDER, () -> new SqlStateExecutionStrategy(3, Duration.ofSeconds(1)));

        ExecutionStrategy exact = registry.resolve(PROVIDER, "db1");
        ExecutionStrategy anyServer = registry.resolve(PROVIDER, "db2");
        ExecutionStrategy unknown = registry.resolve("other", "db1");

        Assertions.assertEquals(7, ((SqlStateExecutionStrategy) exact).getMaxRetryCount());
        Assertions.assertEquals(3, ((SqlStateExecutionStrategy) anyServer).getMaxRetryCount());
        Assertions.assertSame(DefaultExecutionStrategy.INSTANCE, unknown);
    }

    @Test
    public void whenResolvingTwice_expectFreshInstances() {
        ExecutionStrategyRegistry registry = new ExecutionStrategyRegistry();
        registry.register(PROVIDER, SqlStateExecutionStrategy::new);

        Assertions.assertNotSame(registry.resolve(PROVIDER, "db1"), registry.resolve(PROVIDER, "db1"));
    }

    @Test
    public void whenUnregistering_expectFallback() {
        ExecutionStrategyRegistry registry = new ExecutionStrategyRegistry();
        ExecutionStrategyKey key = new ExecutionStrategyKey(PROVIDER, ExecutionStrategyRegistry.ANY_SERVER);
        registry.register(key, SqlStateExecutionStrategy::new);

        Assertions.assertTrue(registry.unregister(key));
        Assertions.assertFalse(registry.unregister(key));
        Assertions.assertSame(DefaultExecutionStrategy.INSTANCE, registry.resolve(PROVIDER, "db1"));
    }
}
