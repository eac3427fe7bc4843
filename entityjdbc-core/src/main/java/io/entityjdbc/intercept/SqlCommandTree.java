package io.entityjdbc.intercept;

import java.util.Objects;

import io.entityjdbc.util.Assert;

/**
 * Command tree holding plain SQL text.
 */
public final class SqlCommandTree implements CommandTree {
    private final String commandText;

    public SqlCommandTree(String commandText) {
        Assert.notNull(commandText, "commandText is null");
        this.commandText = commandText;
    }

    @Override
    public String getCommandText() {
        return commandText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return commandText.equals(((SqlCommandTree) o).commandText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commandText);
    }

    @Override
    public String toString() {
        return commandText;
    }
}
