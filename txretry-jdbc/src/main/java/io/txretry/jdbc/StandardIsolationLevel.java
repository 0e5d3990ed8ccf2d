package io.txretry.jdbc;

import java.util.Arrays;
import java.util.Locale;

/**
 * The four ANSI SQL isolation levels.
 */
public enum StandardIsolationLevel implements IsolationLevel {
    READ_UNCOMMITTED("READ UNCOMMITTED"),
    READ_COMMITTED("READ COMMITTED"),
    REPEATABLE_READ("REPEATABLE READ"),
    SERIALIZABLE("SERIALIZABLE");

    private final String sql;

    StandardIsolationLevel(String sql) {
        this.sql = sql;
    }

    @Override
    public String toSql() {
        return sql;
    }

    /**
     * Parse an isolation level name leniently, accepting both {@code "read committed"}
     * and {@code "READ_COMMITTED"}.
     *
     * @param name the level name
     * @return the isolation level
     * @throws InvalidConfigurationException if the name matches no level
     */
    public static StandardIsolationLevel fromSql(String name) {
        if (name == null) {
            throw new InvalidConfigurationException("Isolation level is null");
        }
        String normalized = name.trim()
                .replace('_', ' ')
                .replaceAll("\\s+", " ")
                .toUpperCase(Locale.ENGLISH);
        return Arrays.stream(values())
                .filter(level -> level.sql.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidConfigurationException("Unknown isolation level: " + name));
    }
}
