package io.entityjdbc.intercept;

import java.sql.Connection;

/**
 * Interceptor for connection lifecycle and transaction completion events.
 */
@SuppressWarnings("EmptyMethod")
public interface ConnectionInterceptor extends DbInterceptor {
    default void opening(ConnectionInterceptionContext<Connection> context) {
    }

    default void opened(ConnectionInterceptionContext<Connection> context) {
    }

    default void closing(Connection connection, ConnectionInterceptionContext<Void> context) {
    }

    default void closed(Connection connection, ConnectionInterceptionContext<Void> context) {
    }

    default void committing(Connection connection, ConnectionInterceptionContext<Void> context) {
    }

    default void committed(Connection connection, ConnectionInterceptionContext<Void> context) {
    }

    default void rollingBack(Connection connection, ConnectionInterceptionContext<Void> context) {
    }

    default void rolledBack(Connection connection, ConnectionInterceptionContext<Void> context) {
    }
}
