package com.fintracker.infrastructure.persistence.repository;

import com.fintracker.domain.model.RecurrenceFrequency;
import com.fintracker.infrastructure.persistence.entity.TransactionEntity;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Access to the {@code transactions} table.
 *
 * Mutating methods must only be called from inside a write queue operation.
 */
public interface TransactionRepository {

    /**
     * Templates still generating instances: recurring and not ended before {@code today}.
     */
    List<TransactionEntity> findActiveRecurringTemplates(LocalDate today);

    /**
     * All recurring templates, newest date first.
     */
    List<TransactionEntity> findRecurringTemplates();

    Optional<TransactionEntity> findById(long id);

    Optional<LocalDate> findLatestInstanceDate(long templateId);

    List<TransactionEntity> findInstances(long templateId);

    long insertTemplate(TransactionEntity template);

    /**
     * Materialize instances of a template in one transaction, skipping dates that already exist.
     *
     * @return number of rows actually inserted
     */
    int insertInstancesIfAbsent(TransactionEntity template, List<LocalDate> dates, Instant createdAt);

    int cancelRecurrence(long templateId, LocalDate endDate);

    int updateRecurrence(long templateId, RecurrenceFrequency frequency, LocalDate endDate);
}
