package com.fintracker.infrastructure.persistence.queue;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Maps failures coming out of the database layer onto {@link DatabaseErrorKind}.
 *
 * Works on result codes, never on message text: the SQLite primary code of the first
 * {@link SQLiteException} in the cause chain decides, and Spring's translated lock and
 * integrity exceptions are honored for drivers Spring knows about.
 */
public final class DatabaseErrorClassifier {

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final int SQLITE_CONSTRAINT = 19;

    private static final int MAX_CAUSE_DEPTH = 16;

    private DatabaseErrorClassifier() {
    }

    public static DatabaseErrorKind classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof SQLiteException) {
                return fromResultCode(((SQLiteException) current).getResultCode());
            }
            if (current instanceof PessimisticLockingFailureException) {
                return DatabaseErrorKind.LOCK_CONTENTION;
            }
            if (current instanceof DataIntegrityViolationException) {
                return DatabaseErrorKind.CONSTRAINT_VIOLATION;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return DatabaseErrorKind.OTHER;
    }

    public static boolean isLockContention(Throwable error) {
        return classify(error).isRetryable();
    }

    static DatabaseErrorKind fromResultCode(SQLiteErrorCode resultCode) {
        if (resultCode == null) {
            return DatabaseErrorKind.OTHER;
        }
        // extended codes (e.g. SQLITE_BUSY_SNAPSHOT) carry the primary code in the low byte
        int primary = resultCode.code & 0xFF;
        switch (primary) {
            case SQLITE_BUSY:
            case SQLITE_LOCKED:
                return DatabaseErrorKind.LOCK_CONTENTION;
            case SQLITE_CONSTRAINT:
                return DatabaseErrorKind.CONSTRAINT_VIOLATION;
            default:
                return DatabaseErrorKind.OTHER;
        }
    }
}
