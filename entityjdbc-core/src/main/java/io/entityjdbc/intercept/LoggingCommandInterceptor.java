package io.entityjdbc.intercept;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.entityjdbc.util.Assert;
import io.entityjdbc.util.DurationFormat;
import io.entityjdbc.util.ExceptionUtils;
import io.entityjdbc.util.TraceUtils;

/**
 * Interceptor writing command and connection events to a logger at debug level. Optionally
 * restricted to the events of a single session.
 */
public class LoggingCommandInterceptor implements CommandInterceptor, ConnectionInterceptor {
    private static final AtomicLong sequenceNumber = new AtomicLong(0);

    private static final AtomicLong instanceNumber = new AtomicLong(0);

    private final String stateKey
            = LoggingCommandInterceptor.class.getName() + "#" + instanceNumber.incrementAndGet();

    private final Logger logger;

    private final Session session;

    private boolean masked = true;

    public LoggingCommandInterceptor() {
        this(LoggerFactory.getLogger(LoggingCommandInterceptor.class), null);
    }

    public LoggingCommandInterceptor(Logger logger, Session session) {
        Assert.notNull(logger, "logger is null");
        this.logger = logger;
        this.session = session;
    }

    public LoggingCommandInterceptor setMasked(boolean masked) {
        this.masked = masked;
        return this;
    }

    public boolean isMasked() {
        return masked;
    }

    public Session getSession() {
        return session;
    }

    @Override
    public void nonQueryExecuting(DbCommand command, CommandExecutionContext<Long> context) {
        logExecuting(command, context);
    }

    @Override
    public void nonQueryExecuted(DbCommand command, CommandExecutionContext<Long> context) {
        logExecuted(command, context, context.getResult() != null ? "rows=" + context.getResult() : null);
    }

    @Override
    public void readerExecuting(DbCommand command, CommandExecutionContext<ResultSet> context) {
        logExecuting(command, context);
    }

    @Override
    public void readerExecuted(DbCommand command, CommandExecutionContext<ResultSet> context) {
        logExecuted(command, context, null);
    }

    @Override
    public void scalarExecuting(DbCommand command, CommandExecutionContext<Object> context) {
        logExecuting(command, context);
    }

    @Override
    public void scalarExecuted(DbCommand command, CommandExecutionContext<Object> context) {
        logExecuted(command, context,
                "value=" + TraceUtils.parameterAsString(context.getResult(), masked));
    }

    @Override
    public void executeExecuting(DbCommand command, CommandExecutionContext<Boolean> context) {
        logExecuting(command, context);
    }

    @Override
    public void executeExecuted(DbCommand command, CommandExecutionContext<Boolean> context) {
        logExecuted(command, context, context.getResult() != null ? "resultSet=" + context.getResult() : null);
    }

    @Override
    public void opened(ConnectionInterceptionContext<Connection> context) {
        logConnectionEvent("opened", context);
    }

    @Override
    public void closed(Connection connection, ConnectionInterceptionContext<Void> context) {
        logConnectionEvent("closed", context);
    }

    @Override
    public void committed(Connection connection, ConnectionInterceptionContext<Void> context) {
        logConnectionEvent("committed", context);
    }

    @Override
    public void rolledBack(Connection connection, ConnectionInterceptionContext<Void> context) {
        logConnectionEvent("rolled back", context);
    }

    protected boolean isLogged(AbstractInterceptionContext<?> context) {
        return logger.isDebugEnabled() && (session == null || context.hasSession(session));
    }

    private void logExecuting(DbCommand command, CommandExecutionContext<?> context) {
        if (!isLogged(context)) {
            return;
        }
        long no = sequenceNumber.incrementAndGet();
        context.setUserState(stateKey, new long[] {no, System.nanoTime()});

        StringBuilder sb = new StringBuilder();
        sb.append(">> executing [");
        sb.append(no);
        sb.append("]");
        if (context.isAsync()) {
            sb.append("[async]");
        }
        sb.append(" ");
        sb.append(TraceUtils.commandText(command.getCommandText()));
        if (!command.getParameters().isEmpty()) {
            sb.append(" [");
            sb.append(TraceUtils.parametersToString(command.getParameters(), masked));
            sb.append("]");
        }

        logger.debug(sb.toString());
    }

    private void logExecuted(DbCommand command, CommandExecutionContext<?> context, String outcome) {
        if (!isLogged(context)) {
            return;
        }
        long no = 0;
        Duration elapsed = null;
        Object userState = context.findUserState(stateKey);
        if (userState instanceof long[]) {
            long[] state = (long[]) userState;
            no = state[0];
            elapsed = Duration.ofNanos(System.nanoTime() - state[1]);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("<< executed [");
        sb.append(no);
        sb.append("]");

        Throwable ex = context.getException();
        if (context.getTaskStatus() == TaskStatus.CANCELED) {
            sb.append("[canceled]");
        } else if (ex != null) {
            sb.append("[failed]");
        } else {
            sb.append("[completed]");
        }

        if (context.isAsync()) {
            sb.append("[async]");
        }

        if (elapsed != null) {
            sb.append("[");
            sb.append(DurationFormat.formatDuration(elapsed));
            sb.append("]");
        }

        if (ex != null) {
            sb.append("[error=");
            sb.append(ExceptionUtils.getMostSpecificCause(ex).getMessage());
            sb.append("]");
            if (ex instanceof SQLException) {
                sb.append("[sqlState=");
                sb.append(((SQLException) ex).getSQLState());
                sb.append("]");
            }
        } else if (outcome != null) {
            sb.append("[");
            sb.append(outcome);
            sb.append("]");
        }

        sb.append(" ");
        sb.append(TraceUtils.commandText(command.getCommandText()));

        logger.debug(sb.toString());
    }

    private void logConnectionEvent(String event, ConnectionInterceptionContext<?> context) {
        if (!isLogged(context)) {
            return;
        }
        if (context.getException() != null) {
            logger.debug("Connection {} failed: {}", event,
                    ExceptionUtils.getMostSpecificCause(context.getException()).getMessage());
        } else {
            logger.debug("Connection {}", event);
        }
    }
}
