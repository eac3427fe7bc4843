package io.entityjdbc.intercept;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

@Tag("unit-test")
public class ConnectionDispatcherTest {
    private ConnectionDispatcher dispatcher;

    private Connection connectionMock;

    private List<String> events;

    @BeforeEach
    public void setUp() {
        dispatcher = new ConnectionDispatcher();
        connectionMock = Mockito.mock(Connection.class);
        events = new ArrayList<>();
    }

    @Test
    public void whenOpening_expectOpenedHookSeesConnection() throws SQLException {
        dispatcher.getInternalDispatcher().add(new ConnectionInterceptor() {
            @Override
            public void opening(ConnectionInterceptionContext<Connection> context) {
                events.add("opening");
            }

            @Override
            public void opened(ConnectionInterceptionContext<Connection> context) {
                Assertions.assertSame(connectionMock, context.getResult());
                events.add("opened");
            }
        });

        Connection connection = dispatcher.open(() -> connectionMock, InterceptionContext.EMPTY);

        Assertions.assertSame(connectionMock, connection);
        Assertions.assertEquals(List.of("opening", "opened"), events);
    }

    @Test
    public void whenCommitting_expectHooksAroundCommit() throws SQLException {
        dispatcher.getInternalDispatcher().add(new ConnectionInterceptor() {
            @Override
            public void committing(Connection connection, ConnectionInterceptionContext<Void> context) {
                events.add("committing");
            }

            @Override
            public void committed(Connection connection, ConnectionInterceptionContext<Void> context) {
                Assertions.assertTrue(context.isExecuted());
                events.add("committed");
            }
        });

        dispatcher.commit(connectionMock, InterceptionContext.EMPTY);

        Mockito.verify(connectionMock).commit();
        Assertions.assertEquals(List.of("committing", "committed"), events);
    }

    @Test
    public void whenRollbackFails_expectExceptionAfterRolledBackHook() throws SQLException {
        SQLException failure = new SQLException("Connection lost", "08006");
        Mockito.doThrow(failure).when(connectionMock).rollback();
        dispatcher.getInternalDispatcher().add(new ConnectionInterceptor() {
            @Override
            public void rolledBack(Connection connection, ConnectionInterceptionContext<Void> context) {
                Assertions.assertSame(failure, context.getException());
                events.add("rolledBack");
            }
        });

        SQLException ex = Assertions.assertThrows(SQLException.class,
                () -> dispatcher.rollback(connectionMock, InterceptionContext.EMPTY));

        Assertions.assertSame(failure, ex);
        Assertions.assertEquals(List.of("rolledBack"), events);
    }

    @Test
    public void whenClosingSuppressed_expectConnectionLeftOpen() throws SQLException {
        dispatcher.getInternalDispatcher().add(new ConnectionInterceptor() {
            @Override
            public void closing(Connection connection, ConnectionInterceptionContext<Void> context) {
                context.suppressExecution();
            }
        });

        dispatcher.close(connectionMock, InterceptionContext.EMPTY);

        Mockito.verify(connectionMock, Mockito.never()).close();
    }

    @Test
    public void whenNoInterceptors_expectPlainInvocation() throws SQLException {
        dispatcher.close(connectionMock, InterceptionContext.EMPTY);

        Mockito.verify(connectionMock).close();
    }
}
