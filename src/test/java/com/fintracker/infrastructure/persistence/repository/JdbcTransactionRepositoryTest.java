package com.fintracker.infrastructure.persistence.repository;

import com.fintracker.domain.model.RecurrenceFrequency;
import com.fintracker.infrastructure.persistence.entity.TransactionEntity;
import com.fintracker.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTransactionRepositoryTest {

    private static final Instant CREATED_AT = Instant.parse("2026-03-15T12:00:00Z");

    @TempDir
    Path tempDir;

    private TestDatabase database;
    private JdbcTransactionRepository repository;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create(tempDir);
        repository = new JdbcTransactionRepository(database.jdbcTemplate(), database.transactionManager());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private TransactionEntity saveTemplate(LocalDate date, LocalDate endDate) {
        TransactionEntity template = TransactionEntity.builder()
                .walletId(3L)
                .type(TransactionEntity.TransactionType.INCOME)
                .amount(new BigDecimal("2500.00"))
                .category("Salary")
                .date(date)
                .recurring(true)
                .recurrenceFrequency(RecurrenceFrequency.MONTHLY)
                .recurrenceEndDate(endDate)
                .createdAt(CREATED_AT)
                .build();
        long id = repository.insertTemplate(template);
        return repository.findById(id).orElseThrow();
    }

    @Test
    void insertTemplate_roundTripsEveryColumn() {
        TransactionEntity template = saveTemplate(LocalDate.of(2026, 1, 25), LocalDate.of(2026, 12, 31));

        assertNotNull(template.getId());
        assertEquals(3L, template.getWalletId());
        assertEquals(TransactionEntity.TransactionType.INCOME, template.getType());
        assertEquals(0, template.getAmount().compareTo(new BigDecimal("2500")));
        assertEquals(LocalDate.of(2026, 1, 25), template.getDate());
        assertTrue(template.isRecurring());
        assertEquals(RecurrenceFrequency.MONTHLY, template.getRecurrenceFrequency());
        assertEquals(LocalDate.of(2026, 12, 31), template.getRecurrenceEndDate());
        assertNull(template.getParentTransactionId());
        assertEquals(CREATED_AT, template.getCreatedAt());
    }

    @Test
    void insertInstancesIfAbsent_skipsExistingDates() {
        TransactionEntity template = saveTemplate(LocalDate.of(2026, 1, 25), null);
        List<LocalDate> dates = List.of(LocalDate.of(2026, 2, 25), LocalDate.of(2026, 3, 25));

        assertEquals(2, repository.insertInstancesIfAbsent(template, dates, CREATED_AT));
        assertEquals(0, repository.insertInstancesIfAbsent(template, dates, CREATED_AT));
        assertEquals(1, repository.insertInstancesIfAbsent(template,
                List.of(LocalDate.of(2026, 3, 25), LocalDate.of(2026, 4, 25)), CREATED_AT));

        assertEquals(3, repository.findInstances(template.getId()).size());
        assertEquals(Optional.of(LocalDate.of(2026, 4, 25)), repository.findLatestInstanceDate(template.getId()));
    }

    @Test
    void findLatestInstanceDate_withoutInstances_isEmpty() {
        TransactionEntity template = saveTemplate(LocalDate.of(2026, 1, 25), null);

        assertEquals(Optional.empty(), repository.findLatestInstanceDate(template.getId()));
    }

    @Test
    void findActiveRecurringTemplates_excludesEndedAndCancelled() {
        TransactionEntity open = saveTemplate(LocalDate.of(2026, 1, 1), null);
        TransactionEntity endsToday = saveTemplate(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 3, 15));
        TransactionEntity ended = saveTemplate(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 3, 14));
        TransactionEntity cancelled = saveTemplate(LocalDate.of(2026, 1, 1), null);
        repository.cancelRecurrence(cancelled.getId(), LocalDate.of(2026, 3, 15));

        List<Long> ids = repository.findActiveRecurringTemplates(LocalDate.of(2026, 3, 15)).stream()
                .map(TransactionEntity::getId)
                .toList();

        assertEquals(List.of(open.getId(), endsToday.getId()), ids);
        assertFalse(ids.contains(ended.getId()));
    }

    @Test
    void updateRecurrence_clearsEndDate() {
        TransactionEntity template = saveTemplate(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 6, 1));

        assertEquals(1, repository.updateRecurrence(template.getId(), RecurrenceFrequency.YEARLY, null));

        TransactionEntity updated = repository.findById(template.getId()).orElseThrow();
        assertEquals(RecurrenceFrequency.YEARLY, updated.getRecurrenceFrequency());
        assertNull(updated.getRecurrenceEndDate());
    }
}
