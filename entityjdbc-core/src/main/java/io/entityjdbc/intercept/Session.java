package io.entityjdbc.intercept;

/**
 * A higher-level unit of work that interception contexts can be associated with, so that
 * interceptors can tell which session an event belongs to. Closed sessions are dropped from
 * contexts when they are copied.
 */
public interface Session {
    boolean isClosed();
}
