package io.txretry.jdbc.fault;

import org.postgresql.util.PSQLState;

/**
 * Thrown when a transaction operation fails (commit, rollback, savepoint).
 */
public class TransactionException extends SqlFaultException {
    public TransactionException(String reason) {
        super(reason);
    }

    public TransactionException(String reason, PSQLState state) {
        super(reason, state);
    }

    public TransactionException(String reason, String sqlState, int vendorCode, Throwable cause) {
        super(reason, sqlState, vendorCode, cause);
    }
}
