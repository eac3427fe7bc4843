package io.entityjdbc.intercept;

import java.sql.Statement;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import io.entityjdbc.util.Assert;

/**
 * A command about to be executed: the statement, its SQL text and the parameters bound to
 * it, keyed by 1-based index.
 */
public final class DbCommand {
    private final Statement statement;

    private final String commandText;

    private final Map<Integer, Object> parameters;

    public DbCommand(Statement statement, String commandText) {
        this(statement, commandText, Collections.emptyMap());
    }

    public DbCommand(Statement statement, String commandText, Map<Integer, Object> parameters) {
        Assert.notNull(statement, "statement is null");
        Assert.notNull(commandText, "commandText is null");
        Assert.notNull(parameters, "parameters is null");
        this.statement = statement;
        this.commandText = commandText;
        this.parameters = Collections.unmodifiableMap(new TreeMap<>(parameters));
    }

    public Statement getStatement() {
        return statement;
    }

    public String getCommandText() {
        return commandText;
    }

    public Map<Integer, Object> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "DbCommand{" +
                "commandText='" + commandText + '\'' +
                ", parameters=" + parameters.size() +
                '}';
    }
}
