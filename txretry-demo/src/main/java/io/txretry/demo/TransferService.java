package io.txretry.demo;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import io.txretry.jdbc.TransactionCallback;

/**
 * Balanced multi-leg funds transfers between accounts.
 */
public abstract class TransferService {
    private TransferService() {
    }

    /**
     * Create a transaction callback applying all legs of a transfer. Legs must sum to zero
     * and no account may end up with a negative balance.
     *
     * @param legs the transfer legs
     * @return callback returning the checksum of the legs
     */
    public static TransactionCallback<BigDecimal> transfer(List<AccountLeg> legs) {
        return conn -> {
            BigDecimal checksum = BigDecimal.ZERO;

            for (AccountLeg leg : legs) {
                checksum = checksum.add(leg.getAmount());
            }

            if (checksum.compareTo(BigDecimal.ZERO) != 0) {
                throw new DataAccessException(
                        "Sum of account legs must equal 0 (got " + checksum.toPlainString() + ")");
            }

            for (AccountLeg leg : legs) {
                BigDecimal balance = readBalance(conn, leg.getAccountId()).add(leg.getAmount());

                if (balance.compareTo(BigDecimal.ZERO) < 0) {
                    throw new DataAccessException(
                            "Negative balance outcome for account ID " + leg.getAccountId());
                }
                updateBalance(conn, leg.getAccountId(), balance);
            }

            return checksum;
        };
    }

    static BigDecimal readBalance(Connection conn, Long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT balance FROM account WHERE id = ?")) {
            ps.setLong(1, id);

            try (ResultSet res = ps.executeQuery()) {
                if (!res.next()) {
                    throw new DataAccessException("Account not found: " + id);
                }
                return res.getBigDecimal("balance");
            }
        }
    }

    static void updateBalance(Connection conn, Long id, BigDecimal balance) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE account SET balance = ?, updated_at = clock_timestamp() WHERE id = ?")) {
            ps.setBigDecimal(1, balance);
            ps.setLong(2, id);
            if (ps.executeUpdate() != 1) {
                throw new DataAccessException("Rows affected != 1 for " + id);
            }
        }
    }
}
