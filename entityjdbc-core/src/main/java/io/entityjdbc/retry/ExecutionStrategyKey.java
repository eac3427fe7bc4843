package io.entityjdbc.retry;

import java.util.Objects;

import io.entityjdbc.util.Assert;

/**
 * Identifies the data source an execution strategy applies to, by provider invariant name
 * (for example a JDBC driver name) and server name. Both parts compare case-sensitively.
 */
public final class ExecutionStrategyKey {
    private final String providerInvariantName;

    private final String serverName;

    public ExecutionStrategyKey(String providerInvariantName, String serverName) {
        Assert.hasText(providerInvariantName, "providerInvariantName is empty");
        Assert.hasText(serverName, "serverName is empty");
        this.providerInvariantName = providerInvariantName;
        this.serverName = serverName;
    }

    public String getProviderInvariantName() {
        return providerInvariantName;
    }

    public String getServerName() {
        return serverName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExecutionStrategyKey that = (ExecutionStrategyKey) o;
        return providerInvariantName.equals(that.providerInvariantName)
                && serverName.equals(that.serverName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(providerInvariantName, serverName);
    }

    @Override
    public String toString() {
        return providerInvariantName + "@" + serverName;
    }
}
