package io.txretry.jdbc.fault;

import org.postgresql.util.PSQLState;

/**
 * Thrown when the server aborts the transaction due to a deadlock or serialization conflict.
 *
 * <p>Safe to retry once the competing transaction has been rolled back.
 */
public class DeadlockException extends TransactionException implements RetryableException {
    public DeadlockException(String reason) {
        super(reason);
    }

    public DeadlockException(String reason, PSQLState state) {
        super(reason, state);
    }

    public DeadlockException(String reason, String sqlState, int vendorCode, Throwable cause) {
        super(reason, sqlState, vendorCode, cause);
    }
}
