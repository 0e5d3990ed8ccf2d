package io.txretry.jdbc;

/**
 * Transaction isolation level applied at the start of each attempt. Opaque to the retry
 * policy, allowing database specific levels beside {@link StandardIsolationLevel}.
 */
public interface IsolationLevel {
    /**
     * @return the SQL representation, as used in {@code SET TRANSACTION ISOLATION LEVEL <level>}
     */
    String toSql();
}
