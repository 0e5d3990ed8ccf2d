package io.txretry.jdbc.fault;

import java.util.Optional;

import io.txretry.jdbc.util.Assert;

/**
 * Closed taxonomy of SQL fault kinds and their fixed retry disposition.
 *
 * <p>Constants are declared most specific first, so {@link #of(Throwable)} resolves a
 * {@link DeadlockException} to {@link #DEADLOCK} rather than to its {@link #TRANSACTION} ancestor.
 */
public enum FaultKind {
    DEADLOCK(DeadlockException.class, true),
    LOCK_WAIT_TIMEOUT(LockWaitTimeoutException.class, true),
    CONSTRAINT_VIOLATION(ConstraintViolationException.class, false),
    AUTHENTICATION(AuthenticationException.class, false),
    CONNECTION(ConnectionException.class, false),
    PREPARED_STATEMENT_INVALID(PreparedStatementException.class, false),
    QUERY(QueryException.class, false),
    TRANSACTION(TransactionException.class, false),
    TIMEOUT(TimeoutException.class, false),
    /**
     * Any fault outside the built-in taxonomy, including application-defined ones.
     */
    UNCLASSIFIED(null, false);

    private final Class<? extends SqlFaultException> faultType;

    private final boolean retryable;

    FaultKind(Class<? extends SqlFaultException> faultType, boolean retryable) {
        this.faultType = faultType;
        this.retryable = retryable;
    }

    public Optional<Class<? extends SqlFaultException>> getFaultType() {
        return Optional.ofNullable(faultType);
    }

    /**
     * @return true if faults of this kind carry the {@link RetryableException} marker
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * @return true if faults of this kind are never retried, regardless of any extension rule
     */
    public boolean isPermanent() {
        return !retryable && faultType != null;
    }

    public boolean isUnclassified() {
        return faultType == null;
    }

    /**
     * Resolve the most specific kind of a fault.
     *
     * @param fault the fault to classify
     * @return the fault kind, {@link #UNCLASSIFIED} for anything outside the taxonomy
     */
    public static FaultKind of(Throwable fault) {
        Assert.notNull(fault, "fault is null");
        for (FaultKind kind : values()) {
            if (kind.faultType != null && kind.faultType.isInstance(fault)) {
                return kind;
            }
        }
        return UNCLASSIFIED;
    }

    /**
     * Capability query for the opt-in retry marker.
     *
     * @param fault the fault to inspect
     * @return true if the fault declares itself retryable
     */
    public static boolean isRetryable(Throwable fault) {
        return fault instanceof RetryableException;
    }
}
