package io.txretry.jdbc.fault;

import org.postgresql.util.PSQLState;

/**
 * Thrown when a statement is rejected by the server, for example a syntax or data error.
 */
public class QueryException extends SqlFaultException {
    public QueryException(String reason) {
        super(reason);
    }

    public QueryException(String reason, PSQLState state) {
        super(reason, state);
    }

    public QueryException(String reason, String sqlState, int vendorCode, Throwable cause) {
        super(reason, sqlState, vendorCode, cause);
    }
}
