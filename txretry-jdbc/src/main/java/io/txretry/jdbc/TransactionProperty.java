package io.txretry.jdbc;

import java.sql.DriverPropertyInfo;
import java.util.Properties;

/**
 * Enum of transaction configuration properties.
 */
public enum TransactionProperty {
    ATTEMPTS(
            "transactionAttempts",
            "1",
            false,
            "Total number of attempts for a transaction, including the first one. "
                    + "A value of 1 disables retries. Only faults classified as retryable are retried, "
                    + "see 'retryableExceptions'.",
            new String[] {"1", "3", "5", "10"}),

    ISOLATION_LEVEL(
            "transactionIsolationLevel",
            "",
            false,
            "Isolation level applied at the start of each transaction attempt. "
                    + "When empty, the server default isolation level is used.",
            new String[] {"READ UNCOMMITTED", "READ COMMITTED", "REPEATABLE READ", "SERIALIZABLE"}),

    RETRYABLE_EXCEPTIONS(
            "retryableExceptions",
            "",
            false,
            "Comma separated list of exception class names to retry in addition to faults "
                    + "implementing 'io.txretry.jdbc.fault.RetryableException'. "
                    + "Known permanent SQL faults (constraint violations, connection errors etc) are never "
                    + "retried even if listed here.",
            new String[] {}),

    RETRY_LISTENER_CLASSNAME(
            "retryListenerClassName",
            "io.txretry.jdbc.retry.LoggingRetryListener",
            false,
            "Name of class that implements 'io.txretry.jdbc.retry.RetryListener' to be used to receive "
                    + "callback events when retries occur. "
                    + "One instance is created for each transaction template.",
            new String[] {});

    private final String name;

    private final String defaultValue;

    private final boolean required;

    private final String description;

    private final String[] choices;

    TransactionProperty(String name, String defaultValue, boolean required, String description, String[] choices) {
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
