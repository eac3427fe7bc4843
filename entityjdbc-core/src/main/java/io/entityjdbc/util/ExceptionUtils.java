package io.entityjdbc.util;

import java.lang.reflect.UndeclaredThrowableException;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.postgresql.util.PSQLState;

public abstract class ExceptionUtils {
    private static final EnumSet<PSQLState> PSQL_STATES = EnumSet.allOf(PSQLState.class);

    private ExceptionUtils() {
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

    public static String toNestedString(Throwable ex) {
        if (ex instanceof SQLException) {
            return toNestedString((SQLException) ex);
        }
        return "  " + ex;
    }

    public static PSQLState toPSQLState(String state) {
        return PSQL_STATES.stream()
                .filter(s -> s.getState().equals(state))
                .findFirst().orElse(PSQLState.UNKNOWN_STATE);
    }

    public static Throwable getRootCause(Throwable original) {
        if (original == null) {
            return null;
        }
        Throwable rootCause = null;
        Throwable cause = original.getCause();
        while (cause != null && cause != rootCause) {
            rootCause = cause;
            cause = cause.getCause();
        }
        return rootCause;
    }

    public static Throwable getMostSpecificCause(Throwable original) {
        Throwable rootCause = getRootCause(original);
        return (rootCause != null ? rootCause : original);
    }

    /**
     * Strip the wrappers a {@code CompletableFuture} puts around the actual failure.
     *
     * @param ex the exception passed to a completion stage callback
     * @return the failure of the originating stage
     */
    public static Throwable unwrapCompletionException(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Rethrow the given throwable unchanged if it is an SQLException or unchecked, otherwise
     * wrap it in an {@link UndeclaredThrowableException}.
     *
     * @param ex the throwable to rethrow
     * @param <T> phantom return type allowing {@code throw rethrow(ex)}
     * @return never
     * @throws SQLException if the throwable is an SQLException
     */
    public static <T extends RuntimeException> T rethrow(Throwable ex) throws SQLException {
        if (ex instanceof SQLException) {
            throw (SQLException) ex;
        }
        if (ex instanceof RuntimeException) {
            throw (RuntimeException) ex;
        }
        if (ex instanceof Error) {
            throw (Error) ex;
        }
        throw new UndeclaredThrowableException(ex, "Undeclared checked exception");
    }
}
