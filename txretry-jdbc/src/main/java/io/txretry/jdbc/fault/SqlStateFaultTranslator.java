package io.txretry.jdbc.fault;

import java.sql.SQLDataException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLInvalidAuthorizationSpecException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

import org.postgresql.util.PSQLState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.txretry.jdbc.util.ExceptionUtils;

/**
 * Default fault translator classifying by SQL state, MySQL vendor code and the
 * standard JDBC exception subclasses.
 */
public class SqlStateFaultTranslator implements FaultTranslator {
    public static final SqlStateFaultTranslator INSTANCE = new SqlStateFaultTranslator();

    // MySQL ER_LOCK_DEADLOCK
    public static final int MYSQL_DEADLOCK = 1213;

    // MySQL ER_LOCK_WAIT_TIMEOUT
    public static final int MYSQL_LOCK_WAIT_TIMEOUT = 1205;

    // PostgreSQL deadlock_detected
    public static final String DEADLOCK_DETECTED = "40P01";

    // PostgreSQL lock_not_available, raised on lock_timeout and NOWAIT
    public static final String LOCK_NOT_AVAILABLE = "55P03";

    // Server is not accepting new transactions on existing connections
    public static final String ADMIN_SHUTDOWN = "57P01";

    private static final Logger logger = LoggerFactory.getLogger(SqlStateFaultTranslator.class);

    @Override
    public SQLException translate(SQLException ex) {
        // Already classified, or declared retryable by the application
        if (ex instanceof SqlFaultException || ex instanceof RetryableException) {
            return ex;
        }

        SQLException fault = classify(ex);
        if (fault != ex && logger.isDebugEnabled()) {
            logger.debug("Translated SQL exception to [{}]\n{}",
                    fault.getClass().getSimpleName(), ExceptionUtils.toNestedString(ex));
        }
        return fault;
    }

    protected SQLException classify(SQLException ex) {
        final String state = ex.getSQLState();
        final String stateClass = ExceptionUtils.toSQLStateClass(state);
        final int vendorCode = ex.getErrorCode();
        final String reason = ex.getMessage();

        if (vendorCode == MYSQL_LOCK_WAIT_TIMEOUT || LOCK_NOT_AVAILABLE.equals(state)) {
            return new LockWaitTimeoutException(reason, state, vendorCode, ex);
        }
        if (vendorCode == MYSQL_DEADLOCK
                || PSQLState.SERIALIZATION_FAILURE.getState().equals(state)
                || DEADLOCK_DETECTED.equals(state)) {
            return new DeadlockException(reason, state, vendorCode, ex);
        }
        if (ex instanceof SQLIntegrityConstraintViolationException || "23".equals(stateClass)) {
            return new ConstraintViolationException(reason, state, vendorCode, ex);
        }
        if (ex instanceof SQLInvalidAuthorizationSpecException || "28".equals(stateClass)) {
            return new AuthenticationException(reason, state, vendorCode, ex);
        }
        if (ex instanceof SQLTimeoutException || PSQLState.QUERY_CANCELED.getState().equals(state)) {
            return new TimeoutException(reason, state, vendorCode, ex);
        }
        if (isConnectionError(ex)) {
            return new ConnectionException(reason, state, vendorCode, ex);
        }
        if (PSQLState.INVALID_SQL_STATEMENT_NAME.getState().equals(state)) {
            return new PreparedStatementException(reason, state, vendorCode, ex);
        }
        switch (stateClass) {
            case "25":
            case "2D":
            case "3B":
            case "40":
                return new TransactionException(reason, state, vendorCode, ex);
            case "22":
            case "42":
                return new QueryException(reason, state, vendorCode, ex);
            default:
                break;
        }
        if (ex instanceof SQLSyntaxErrorException || ex instanceof SQLDataException) {
            return new QueryException(reason, state, vendorCode, ex);
        }
        return ex;
    }

    protected boolean isConnectionError(SQLException ex) {
        String sqlState = ex.getSQLState();
        return ex instanceof SQLNonTransientConnectionException
                || ex instanceof SQLTransientConnectionException
                || "08".equals(ExceptionUtils.toSQLStateClass(sqlState))
                || ADMIN_SHUTDOWN.equals(sqlState);
    }
}
