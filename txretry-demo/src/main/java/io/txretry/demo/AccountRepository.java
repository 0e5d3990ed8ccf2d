package io.txretry.demo;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

public abstract class AccountRepository {
    private AccountRepository() {
    }

    public static void findAccountIds(Connection conn, List<Long> systemAccounts, List<Long> userAccounts)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT id, account_type FROM account ORDER BY id");
             ResultSet resultSet = ps.executeQuery()) {
            while (resultSet.next()) {
                String type = resultSet.getString(2);
                if ("S".equalsIgnoreCase(type)) {
                    systemAccounts.add(resultSet.getLong(1));
                } else {
                    userAccounts.add(resultSet.getLong(1));
                }
            }
        }
    }
}
