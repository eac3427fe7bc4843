package io.entityjdbc;

import java.sql.DriverPropertyInfo;
import java.util.Properties;

/**
 * Enum of configuration properties understood by execution strategies, retry listeners
 * and the intercepting data source.
 */
public enum EntityJdbcProperty {
    EXECUTION_STRATEGY_CLASSNAME(
            "executionStrategyClassName",
            "io.entityjdbc.retry.SqlStateExecutionStrategy",
            false,
            "Name of class that implements 'io.entityjdbc.retry.ExecutionStrategy' used to run "
                    + "units of work. The class must have a public no-arg constructor. Strategies extending "
                    + "'io.entityjdbc.retry.SqlStateExecutionStrategy' are configured from the retry properties.",
            new String[] {}),

    RETRY_MAX_COUNT(
            "retryMaxCount",
            "5",
            false,
            "Maximum number of retry attempts on transient failures (serialization conflicts, deadlocks "
                    + "and optionally connection errors). If this limit is exceeded, the execution strategy "
                    + "throws a RetryLimitExceededException wrapping the last transient failure.",
            new String[] {"0", "3", "5", "10", "15"}),

    RETRY_MAX_DELAY(
            "retryMaxDelay",
            "30s",
            false,
            "Maximum delay between two retry attempts in the format of a duration expression (like '12s') "
                    + "or milliseconds.",
            new String[] {"5s", "15s", "30s", "1m"}),

    RETRY_CONNECTION_ERRORS(
            "retryConnectionErrors",
            Boolean.FALSE.toString(),
            false,
            "Treat connection errors (08001, 08003, 08004, 08006, 08007, 08S01 or 57P01 state) as transient. "
                    + "CAUTION! Retrying on anything but serialization conflicts may produce duplicate outcomes "
                    + "if the unit of work is non-idempotent.",
            new String[] {"true", "false"}),

    RETRY_LISTENER_CLASSNAME(
            "retryListenerClassName",
            "io.entityjdbc.retry.LoggingRetryListener",
            false,
            "Name of class that implements 'io.entityjdbc.retry.RetryListener' to be used to receive "
                    + "callback events when retries occur. One instance is created per execution strategy.",
            new String[] {}),

    LOG_COMMANDS(
            "logCommands",
            Boolean.FALSE.toString(),
            false,
            "Register a logging interceptor that writes every command and connection event to the "
                    + "'io.entityjdbc.intercept.LoggingCommandInterceptor' logger.",
            new String[] {"true", "false"}),

    MASK_PARAMETERS(
            "maskParameters",
            Boolean.TRUE.toString(),
            false,
            "Mask statement parameter values in log output.",
            new String[] {"true", "false"});

    private final String name;

    private final String defaultValue;

    private final boolean required;

    private final String description;

    private final String[] choices;

    EntityJdbcProperty(String name, String defaultValue, boolean required, String description, String[] choices) {
        this.name = name;
        this.defaultValue = defaultValue;
        this.required = required;
        this.description = description;
        this.choices = choices;
    }

    public DriverPropertyInfo toDriverPropertyInfo(Properties properties) {
        DriverPropertyInfo propertyInfo
                = new DriverPropertyInfo(name, properties.getProperty(name, defaultValue));
        propertyInfo.required = required;
        propertyInfo.description = description;
        propertyInfo.choices = choices;
        return propertyInfo;
    }

    public String getValue(Properties properties) {
        return toDriverPropertyInfo(properties).value;
    }

    public String getName() {
        return name;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public boolean isRequired() {
        return required;
    }

    public String getDescription() {
        return description;
    }

    public String[] getChoices() {
        return choices;
    }
}
