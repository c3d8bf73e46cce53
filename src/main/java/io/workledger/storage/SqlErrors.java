package io.workledger.storage;

import io.workledger.error.BackendFailureException;
import io.workledger.error.DuplicateException;
import io.workledger.error.InvalidArgumentException;
import io.workledger.error.WorkLedgerException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;

/**
 * Maps backend exceptions onto the error taxonomy. Uniqueness violations become
 * {@link DuplicateException}; other constraint violations (foreign key, not null, check) are
 * malformed input; everything else is a retryable {@link BackendFailureException}.
 */
public final class SqlErrors {
    private SqlErrors() {
    }

    public static WorkLedgerException translate(String context, SQLException e) {
        Violation violation = classify(e);
        return switch (violation) {
            case UNIQUE -> new DuplicateException(context + " already exists: " + rootMessage(e), e);
            case OTHER_CONSTRAINT -> new InvalidArgumentException(context + " violates a constraint: " + rootMessage(e), e);
            case NONE -> new BackendFailureException("Backend failure during " + context + ": " + rootMessage(e), e);
        };
    }

    public static boolean isUniqueViolation(SQLException e) {
        return classify(e) == Violation.UNIQUE;
    }

    /**
     * Duplicate carrying the caller's key values, e.g. {@code coll_id:scope:name(4:data17:f.1)}, in
     * front of the backend message.
     */
    public static DuplicateException duplicate(String entity, String key, SQLException e) {
        return new DuplicateException(entity + " already exists: " + key + " (" + rootMessage(e) + ")", e);
    }

    private enum Violation { UNIQUE, OTHER_CONSTRAINT, NONE }

    // Batches wrap the driver exception in a BatchUpdateException, so walk causes and the
    // next-exception chain before falling back to the message text.
    private static Violation classify(SQLException e) {
        Throwable current = e;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SQLiteException) {
                Violation byCode = classify(((SQLiteException) current).getResultCode());
                if (byCode != Violation.NONE) {
                    return byCode;
                }
            }
            if (current instanceof SQLException) {
                SQLException sql = (SQLException) current;
                Violation byMessage = classify(sql.getMessage());
                if (byMessage != Violation.NONE) {
                    return byMessage;
                }
                String state = sql.getSQLState();
                if (state != null && state.startsWith("23")) {
                    return Violation.OTHER_CONSTRAINT;
                }
                if (sql.getNextException() != null && sql.getNextException() != current.getCause()) {
                    Violation next = classify(sql.getNextException());
                    if (next != Violation.NONE) {
                        return next;
                    }
                }
            }
            current = current.getCause();
        }
        return Violation.NONE;
    }

    private static Violation classify(SQLiteErrorCode code) {
        if (code == null) {
            return Violation.NONE;
        }
        return switch (code) {
            case SQLITE_CONSTRAINT_UNIQUE, SQLITE_CONSTRAINT_PRIMARYKEY -> Violation.UNIQUE;
            case SQLITE_CONSTRAINT_FOREIGNKEY, SQLITE_CONSTRAINT_NOTNULL, SQLITE_CONSTRAINT_CHECK -> Violation.OTHER_CONSTRAINT;
            default -> Violation.NONE;
        };
    }

    private static Violation classify(String message) {
        if (message == null) {
            return Violation.NONE;
        }
        if (message.contains("UNIQUE constraint failed") || message.contains("PRIMARY KEY")) {
            return Violation.UNIQUE;
        }
        if (message.contains("FOREIGN KEY constraint failed")
                || message.contains("NOT NULL constraint failed")
                || message.contains("CHECK constraint failed")) {
            return Violation.OTHER_CONSTRAINT;
        }
        return Violation.NONE;
    }

    private static String rootMessage(SQLException e) {
        Throwable current = e;
        String message = e.getMessage();
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
            if (current.getMessage() != null) {
                message = current.getMessage();
            }
        }
        return message;
    }
}
