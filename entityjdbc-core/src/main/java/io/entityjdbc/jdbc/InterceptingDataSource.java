package io.entityjdbc.jdbc;

import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Properties;
import java.util.logging.Logger;

import javax.sql.DataSource;

import io.entityjdbc.EntityJdbcInfo;
import io.entityjdbc.EntityJdbcProperty;
import io.entityjdbc.intercept.Dispatchers;
import io.entityjdbc.intercept.Interception;
import io.entityjdbc.intercept.InterceptionContext;
import io.entityjdbc.intercept.LoggingCommandInterceptor;
import io.entityjdbc.util.Assert;
import io.entityjdbc.util.WrapperSupport;

/**
 * Data source decorator handing out connections whose operations are routed through the
 * interception dispatchers. Uses the process-wide dispatchers of {@link Interception} unless
 * given its own.
 */
public class InterceptingDataSource extends WrapperSupport<DataSource> implements DataSource {
    private final Dispatchers dispatchers;

    private volatile InterceptionContext interceptionContext = InterceptionContext.EMPTY;

    public InterceptingDataSource(DataSource delegate) {
        this(delegate, Interception.getDispatch());
    }

    public InterceptingDataSource(DataSource delegate, Dispatchers dispatchers) {
        super(delegate);
        Assert.notNull(dispatchers, "dispatchers is null");
        this.dispatchers = dispatchers;
    }

    /**
     * Register a {@link LoggingCommandInterceptor} with this data source's dispatchers if
     * command logging is enabled.
     *
     * @param properties the configuration properties, see {@link EntityJdbcProperty}
     */
    public void configure(Properties properties) {
        if (Boolean.parseBoolean(EntityJdbcProperty.LOG_COMMANDS.getValue(properties))) {
            LoggingCommandInterceptor interceptor = new LoggingCommandInterceptor()
                    .setMasked(Boolean.parseBoolean(EntityJdbcProperty.MASK_PARAMETERS.getValue(properties)));
            dispatchers.addInterceptor(interceptor);
            logger.info("{} command logging enabled with parameter masking [{}]",
                    EntityJdbcInfo.FULL_NAME, interceptor.isMasked());
        }
    }

    public Dispatchers getDispatchers() {
        return dispatchers;
    }

    public InterceptionContext getInterceptionContext() {
        return interceptionContext;
    }

    /**
     * Set the context passed to interceptors for connections obtained from now on.
     */
    public void setInterceptionContext(InterceptionContext interceptionContext) {
        Assert.notNull(interceptionContext, "interceptionContext is null");
        this.interceptionContext = interceptionContext;
    }

    @Override
    public Connection getConnection() throws SQLException {
        InterceptionContext context = interceptionContext;
        Connection connection = dispatchers.getConnection().open(() -> getDelegate().getConnection(), context);
        return ConnectionInterceptionHandler.proxy(connection, dispatchers, context);
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        InterceptionContext context = interceptionContext;
        Connection connection = dispatchers.getConnection()
                .open(() -> getDelegate().getConnection(username, password), context);
        return ConnectionInterceptionHandler.proxy(connection, dispatchers, context);
    }

    @Override
    public PrintWriter getLogWriter() throws SQLException {
        return getDelegate().getLogWriter();
    }

    @Override
    public void setLogWriter(PrintWriter out) throws SQLException {
        getDelegate().setLogWriter(out);
    }

    @Override
    public void setLoginTimeout(int seconds) throws SQLException {
        getDelegate().setLoginTimeout(seconds);
    }

    @Override
    public int getLoginTimeout() throws SQLException {
        return getDelegate().getLoginTimeout();
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        return getDelegate().getParentLogger();
    }
}
