package io.entityjdbc.intercept;

/**
 * Representation of a command before it is sent to the database, which
 * {@link CommandTreeInterceptor}s can inspect and replace.
 */
public interface CommandTree {
    String getCommandText();
}
