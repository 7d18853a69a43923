package com.fintracker.domain.service;

import com.fintracker.config.AppProperties;
import com.fintracker.domain.model.RecurrenceFrequency;
import com.fintracker.domain.model.RecurringRunResult;
import com.fintracker.infrastructure.persistence.entity.TransactionEntity;
import com.fintracker.infrastructure.persistence.queue.WriteQueue;
import com.fintracker.infrastructure.persistence.repository.TransactionRepository;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecurringTransactionServiceGuardTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 15);

    @Mock private TransactionRepository transactionRepository;

    private MeterRegistry meterRegistry;
    private WriteQueue writeQueue;
    private RecurringTransactionService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        writeQueue = new WriteQueue(new AppProperties.WriteQueue(), RetryRegistry.ofDefaults(), meterRegistry);
        Clock clock = Clock.fixed(Instant.parse("2026-03-15T12:00:00Z"), ZoneOffset.UTC);

        service = new RecurringTransactionService(transactionRepository, writeQueue, clock, meterRegistry, new AppProperties());
    }

    @AfterEach
    void tearDown() {
        writeQueue.close();
    }

    private static TransactionEntity template(long id) {
        return TransactionEntity.builder()
                .id(id)
                .walletId(1L)
                .type(TransactionEntity.TransactionType.EXPENSE)
                .amount(new BigDecimal("9.99"))
                .category("Rent")
                .date(TODAY.minusDays(2))
                .recurring(true)
                .recurrenceFrequency(RecurrenceFrequency.DAILY)
                .build();
    }

    @Test
    void concurrentRun_isSkipped() throws Exception {
        CountDownLatch scanning = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        when(transactionRepository.findActiveRecurringTemplates(TODAY)).thenAnswer(invocation -> {
            scanning.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });

        CompletableFuture<RecurringRunResult> firstRun = CompletableFuture.supplyAsync(service::processRecurringTransactions);
        assertTrue(scanning.await(5, TimeUnit.SECONDS));

        RecurringRunResult concurrent = service.processRecurringTransactions();

        release.countDown();
        RecurringRunResult first = firstRun.get(5, TimeUnit.SECONDS);

        assertEquals(RecurringRunResult.Status.SKIPPED, concurrent.getStatus());
        assertEquals(RecurringRunResult.Status.COMPLETED, first.getStatus());
        verify(transactionRepository, times(1)).findActiveRecurringTemplates(TODAY);
        assertEquals(1.0, meterRegistry.get("recurring.run").tag("result", "skipped").counter().count());
    }

    @Test
    void failingTemplate_abortsTheRun_andNextRunResumes() {
        when(transactionRepository.findActiveRecurringTemplates(TODAY))
                .thenReturn(List.of(template(1), template(2), template(3)));
        when(transactionRepository.findLatestInstanceDate(anyLong())).thenReturn(Optional.empty());
        when(transactionRepository.findLatestInstanceDate(2L))
                .thenThrow(new IllegalStateException("disk I/O error"))
                .thenReturn(Optional.empty());
        when(transactionRepository.insertInstancesIfAbsent(any(), anyList(), any()))
                .thenAnswer(invocation -> invocation.<List<LocalDate>>getArgument(1).size());

        RecurringRunResult failed = service.processRecurringTransactions();

        assertEquals(RecurringRunResult.Status.FAILED, failed.getStatus());
        assertEquals(1, failed.getTemplatesProcessed());
        assertEquals(2, failed.getInstancesCreated());
        assertEquals("disk I/O error", failed.getFailureMessage());
        verify(transactionRepository, never()).findLatestInstanceDate(3L);

        RecurringRunResult resumed = service.processRecurringTransactions();

        assertEquals(RecurringRunResult.Status.COMPLETED, resumed.getStatus());
        assertEquals(3, resumed.getTemplatesProcessed());
        verify(transactionRepository).findLatestInstanceDate(3L);
    }

    @Test
    void failedWrite_isReportedWithItsCause() {
        when(transactionRepository.findActiveRecurringTemplates(TODAY)).thenReturn(List.of(template(7)));
        when(transactionRepository.findLatestInstanceDate(7L)).thenReturn(Optional.empty());
        when(transactionRepository.insertInstancesIfAbsent(any(), anyList(), any()))
                .thenThrow(new IllegalArgumentException("FOREIGN KEY constraint failed"));

        RecurringRunResult result = service.processRecurringTransactions();

        assertEquals(RecurringRunResult.Status.FAILED, result.getStatus());
        assertEquals("FOREIGN KEY constraint failed", result.getFailureMessage());
        assertEquals(1.0, meterRegistry.get("recurring.run").tag("result", "error").counter().count());
    }

    @Test
    void cancelRecurringTransaction_goesThroughTheQueue_withTodayAsEndDate() throws Exception {
        when(transactionRepository.cancelRecurrence(5L, TODAY)).thenReturn(1);

        assertTrue(service.cancelRecurringTransaction(5L).get(5, TimeUnit.SECONDS));
        assertEquals(1.0, meterRegistry.get("db.write.success").counter().count());
    }
}
