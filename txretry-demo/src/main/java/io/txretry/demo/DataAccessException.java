package io.txretry.demo;

/**
 * Business rule violation in a transfer. Unchecked and outside the SQL fault taxonomy,
 * so it is never retried.
 */
public class DataAccessException extends RuntimeException {
    public DataAccessException(String message) {
        super(message);
    }
}
