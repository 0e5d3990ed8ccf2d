package io.txretry.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work executed within a transaction. May be invoked once per attempt, so
 * implementations should not carry side effects outside the connection across attempts.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionCallback<T> {
    T doInTransaction(Connection conn) throws SQLException;
}
