package io.entityjdbc.intercept;

/**
 * Terminal state of an asynchronous operation as seen by interceptors.
 */
public enum TaskStatus {
    RAN_TO_COMPLETION,
    CANCELED,
    FAULTED
}
