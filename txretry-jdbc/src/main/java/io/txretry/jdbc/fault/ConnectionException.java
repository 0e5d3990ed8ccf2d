package io.txretry.jdbc.fault;

import org.postgresql.util.PSQLState;

/**
 * Thrown when a connection cannot be established or is lost.
 */
public class ConnectionException extends SqlFaultException {
    public ConnectionException(String reason) {
        super(reason);
    }

    public ConnectionException(String reason, PSQLState state) {
        super(reason, state);
    }

    public ConnectionException(String reason, String sqlState, int vendorCode, Throwable cause) {
        super(reason, sqlState, vendorCode, cause);
    }
}
