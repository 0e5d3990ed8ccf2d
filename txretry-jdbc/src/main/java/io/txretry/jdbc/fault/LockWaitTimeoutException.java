package io.txretry.jdbc.fault;

import org.postgresql.util.PSQLState;

/**
 * Thrown when the transaction waited too long for a row lock held by another transaction
 * (MySQL error 1205, PostgreSQL lock_not_available).
 *
 * <p>Unlike a general {@link TimeoutException}, a lock wait timeout is a transient concurrency
 * conflict and safe to retry once the competing transaction commits or rolls back.
 */
public class LockWaitTimeoutException extends TimeoutException implements RetryableException {
    public LockWaitTimeoutException(String reason) {
        super(reason);
    }

    public LockWaitTimeoutException(String reason, PSQLState state) {
        super(reason, state);
    }

    public LockWaitTimeoutException(String reason, String sqlState, int vendorCode, Throwable cause) {
        super(reason, sqlState, vendorCode, cause);
    }
}
