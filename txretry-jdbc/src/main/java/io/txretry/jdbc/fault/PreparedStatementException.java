package io.txretry.jdbc.fault;

import org.postgresql.util.PSQLState;

/**
 * Thrown when a prepared statement is invalid or no longer known to the server.
 */
public class PreparedStatementException extends SqlFaultException {
    public PreparedStatementException(String reason) {
        super(reason);
    }

    public PreparedStatementException(String reason, PSQLState state) {
        super(reason, state);
    }

    public PreparedStatementException(String reason, String sqlState, int vendorCode, Throwable cause) {
        super(reason, sqlState, vendorCode, cause);
    }
}
