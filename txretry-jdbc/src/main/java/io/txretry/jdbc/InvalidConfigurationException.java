package io.txretry.jdbc;

/**
 * Thrown when transaction options or template properties are misconfigured.
 * Always raised at configuration time, never while classifying a fault.
 */
public class InvalidConfigurationException extends IllegalArgumentException {
    public InvalidConfigurationException(String msg) {
        super(msg);
    }

    public InvalidConfigurationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
