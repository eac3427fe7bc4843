package io.entityjdbc.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.entityjdbc.retry.DefaultExecutionStrategy;
import io.entityjdbc.retry.ExecutionStrategy;
import io.entityjdbc.retry.ExecutionSuspension;
import io.entityjdbc.retry.TransactionScope;
import io.entityjdbc.util.Assert;
import io.entityjdbc.util.CancellationToken;
import io.entityjdbc.util.ExceptionUtils;

/**
 * Runs units of work in a local transaction on a fresh connection, under an execution
 * strategy. Each attempt gets its own connection and transaction, so a retrying strategy
 * replays the whole unit of work.
 */
public class TransactionTemplate {
    private static final int DEFAULT_ISOLATION = -1;

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final DataSource dataSource;

    private final ExecutionStrategy executionStrategy;

    private int isolationLevel = DEFAULT_ISOLATION;

    private boolean readOnly;

    public TransactionTemplate(DataSource dataSource) {
        this(dataSource, DefaultExecutionStrategy.INSTANCE);
    }

    public TransactionTemplate(DataSource dataSource, ExecutionStrategy executionStrategy) {
        Assert.notNull(dataSource, "dataSource is null");
        Assert.notNull(executionStrategy, "executionStrategy is null");
        this.dataSource = dataSource;
        this.executionStrategy = executionStrategy;
    }

    public ExecutionStrategy getExecutionStrategy() {
        return executionStrategy;
    }

    public int getIsolationLevel() {
        return isolationLevel;
    }

    /**
     * @param isolationLevel one of the {@link Connection} isolation constants
     */
    public void setIsolationLevel(int isolationLevel) {
        Assert.isTrue(isolationLevel == Connection.TRANSACTION_READ_UNCOMMITTED
                || isolationLevel == Connection.TRANSACTION_READ_COMMITTED
                || isolationLevel == Connection.TRANSACTION_REPEATABLE_READ
                || isolationLevel == Connection.TRANSACTION_SERIALIZABLE, "Invalid isolation level: " + isolationLevel);
        this.isolationLevel = isolationLevel;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    public <T> T execute(ConnectionCallback<T> action) throws SQLException {
        Assert.notNull(action, "action is null");
        return executionStrategy.execute(() -> doInTransaction(action));
    }

    /**
     * Run the unit of work on the given executor. Blocking JDBC calls are made on executor
     * threads, which see the retry attempt in progress the same way {@link #execute} does.
     */
    public <T> CompletableFuture<T> executeAsync(ConnectionCallback<T> action,
                                                 Executor executor,
                                                 CancellationToken cancellationToken) {
        Assert.notNull(action, "action is null");
        Assert.notNull(executor, "executor is null");
        return executionStrategy.executeAsync(() -> CompletableFuture.supplyAsync(() -> {
            try {
                return doInTransaction(action);
            } catch (SQLException e) {
                throw new CompletionException(e);
            }
        }, ExecutionSuspension.bind(executor)), cancellationToken);
    }

    protected <T> T doInTransaction(ConnectionCallback<T> action) throws SQLException {
        try (TransactionScope ignored = TransactionScope.begin("transaction-template");
             Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            if (autoCommit) {
                connection.setAutoCommit(false);
            }
            if (isolationLevel != DEFAULT_ISOLATION) {
                connection.setTransactionIsolation(isolationLevel);
            }
            if (readOnly) {
                connection.setReadOnly(true);
            }

            try {
                T result = action.doInConnection(connection);
                connection.commit();
                if (autoCommit) {
                    connection.setAutoCommit(true);
                }
                return result;
            } catch (SQLException | RuntimeException ex) {
                rollback(connection, ex);
                throw ex;
            }
        }
    }

    private void rollback(Connection connection, Throwable cause) {
        try {
            connection.rollback();
        } catch (SQLException ex) {
            logger.warn("Rollback failed after exception in transaction\n{}", ExceptionUtils.toNestedString(ex));
            cause.addSuppressed(ex);
        }
    }
}
