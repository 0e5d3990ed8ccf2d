package io.txretry.jdbc.fault;

import org.postgresql.util.PSQLState;

/**
 * Thrown on an integrity constraint violation (UNIQUE, FOREIGN KEY, NOT NULL, CHECK).
 */
public class ConstraintViolationException extends QueryException {
    public ConstraintViolationException(String reason) {
        super(reason);
    }

    public ConstraintViolationException(String reason, PSQLState state) {
        super(reason, state);
    }

    public ConstraintViolationException(String reason, String sqlState, int vendorCode, Throwable cause) {
        super(reason, sqlState, vendorCode, cause);
    }
}
