package io.entityjdbc.intercept;

/**
 * Hints describing how the results of a command will be consumed.
 */
public enum CommandBehavior {
    DEFAULT,
    SINGLE_RESULT,
    SCHEMA_ONLY,
    KEY_INFO,
    SINGLE_ROW,
    SEQUENTIAL_ACCESS,
    CLOSE_CONNECTION
}
