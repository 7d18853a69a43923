package com.fintracker.infrastructure.persistence.queue;

/**
 * Driver-independent classification of a failed database call.
 */
public enum DatabaseErrorKind {

    /** Database busy or locked by another connection; safe to retry. */
    LOCK_CONTENTION,

    /** Uniqueness or other constraint rejected the statement. */
    CONSTRAINT_VIOLATION,

    OTHER;

    public boolean isRetryable() {
        return this == LOCK_CONTENTION;
    }
}
