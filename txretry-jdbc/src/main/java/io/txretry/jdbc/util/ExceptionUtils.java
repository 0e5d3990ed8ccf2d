package io.txretry.jdbc.util;

import java.sql.SQLException;
import java.util.EnumSet;

import org.postgresql.util.PSQLState;

public abstract class ExceptionUtils {
    private static final EnumSet<PSQLState> PSQL_STATES = EnumSet.allOf(PSQLState.class);

    private ExceptionUtils() {
    }

    /**
     * Render a fault for log output. SQL exceptions are expanded with their state
     * and chained next exceptions, anything else falls back to its string form.
     *
     * @param ex the fault, may be null
     * @return printable representation
     */
    public static String toNestedString(Throwable ex) {
        if (ex instanceof SQLException) {
            return toNestedString((SQLException) ex);
        }
        return "  " + ex;
    }

    public static String toNestedString(SQLException ex) {
        StringBuilder sb = new StringBuilder();
        StringBuilder indent = new StringBuilder().append("  ");

        while (ex != null) {
            String state = ex.getSQLState();
            sb.append(indent)
                    .append(ex)
                    .append("\n")
                    .append(indent)
                    .append("SQL State: ")
                    .append(state)
                    .append(" (")
                    .append(toPSQLState(state))
                    .append(")");
            ex = ex.getNextException();
            if (ex != null) {
                indent.append("  ");
                sb.append("\n");
            }
        }

        return sb.toString();
    }

    public static PSQLState toPSQLState(String state) {
        return PSQL_STATES.stream()
                .filter(s -> s.getState().equals(state))
                .findFirst().orElse(PSQLState.UNKNOWN_STATE);
    }

    /**
     * Two-character SQL state class, like "23" for integrity constraint violations.
     *
     * @param state the SQL state, may be null
     * @return the class or an empty string if the state is absent or malformed
     */
    public static String toSQLStateClass(String state) {
        if (state == null || state.length() < 2) {
            return "";
        }
        return state.substring(0, 2);
    }
}
