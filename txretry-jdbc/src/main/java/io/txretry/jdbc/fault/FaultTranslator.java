package io.txretry.jdbc.fault;

import java.sql.SQLException;

/**
 * Interface specifying the API to be implemented by a class translating raw
 * driver exceptions into the {@link FaultKind} taxonomy.
 *
 * <p>See {@link SqlStateFaultTranslator} for the default implementation.
 */
@FunctionalInterface
public interface FaultTranslator {
    /**
     * Translate a raw SQL exception into a classified fault. Must be idempotent: a
     * {@link SqlFaultException}, an exception implementing {@link RetryableException}, or an
     * exception that cannot be classified, is returned as-is.
     *
     * @param ex the exception thrown by the driver
     * @return a {@link SqlFaultException} subtype carrying {@code ex} as cause, or {@code ex}
     * itself if it cannot be classified
     */
    SQLException translate(SQLException ex);
}
