package io.txretry.jdbc.util;

import java.sql.SQLException;

/**
 * A functional interface representing a java.util.{@link java.util.function.Supplier} for
 * JDBC resources that may throw SQLExceptions.
 *
 * @param <T> type of resource to supply
 */
@FunctionalInterface
public interface ResourceSupplier<T> {
    /**
     * Gets a fresh resource, typically a connection for one transaction attempt.
     *
     * @return the resource
     * @throws SQLException on any SQL exception
     */
    T get() throws SQLException;
}
