package io.txretry.jdbc.fault;

import java.sql.SQLException;

import org.postgresql.util.PSQLState;

/**
 * Base type of all classified SQL faults. Subclasses map one-to-one onto a
 * {@link FaultKind}.
 */
public abstract class SqlFaultException extends SQLException {
    protected SqlFaultException(String reason) {
        super(reason);
    }

    protected SqlFaultException(String reason, PSQLState state) {
        super(reason, state == null ? null : state.getState());
    }

    protected SqlFaultException(String reason, String sqlState, int vendorCode, Throwable cause) {
        super(reason, sqlState, vendorCode, cause);
    }

    public FaultKind getFaultKind() {
        return FaultKind.of(this);
    }
}
