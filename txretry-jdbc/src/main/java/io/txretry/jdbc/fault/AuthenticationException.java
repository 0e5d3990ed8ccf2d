package io.txretry.jdbc.fault;

import org.postgresql.util.PSQLState;

/**
 * Thrown when the server rejects the credentials or authorization of a connection.
 */
public class AuthenticationException extends SqlFaultException {
    public AuthenticationException(String reason) {
        super(reason);
    }

    public AuthenticationException(String reason, PSQLState state) {
        super(reason, state);
    }

    public AuthenticationException(String reason, String sqlState, int vendorCode, Throwable cause) {
        super(reason, sqlState, vendorCode, cause);
    }
}
