package com.fintracker.infrastructure.persistence.queue;

/**
 * A unit of database work submitted to the {@link WriteQueue}.
 *
 * May run more than once when it fails on lock contention, so it must not keep
 * side effects outside the database transaction it opens.
 */
@FunctionalInterface
public interface WriteOperation<T> {

    T execute() throws Exception;
}
