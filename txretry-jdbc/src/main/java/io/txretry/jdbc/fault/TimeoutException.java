package io.txretry.jdbc.fault;

import org.postgresql.util.PSQLState;

/**
 * Thrown when a statement or connection times out, other than a lock wait timeout.
 */
public class TimeoutException extends SqlFaultException {
    public TimeoutException(String reason) {
        super(reason);
    }

    public TimeoutException(String reason, PSQLState state) {
        super(reason, state);
    }

    public TimeoutException(String reason, String sqlState, int vendorCode, Throwable cause) {
        super(reason, sqlState, vendorCode, cause);
    }
}
