package com.fintracker.domain.service;

import com.fintracker.config.AppProperties;
import com.fintracker.domain.model.NewRecurringTransaction;
import com.fintracker.domain.model.RecurrenceFrequency;
import com.fintracker.domain.model.RecurringRunResult;
import com.fintracker.infrastructure.persistence.entity.TransactionEntity;
import com.fintracker.infrastructure.persistence.queue.WriteQueue;
import com.fintracker.infrastructure.persistence.repository.TransactionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Materializes the instances of recurring transaction templates.
 *
 * Processing flow, per active template:
 * 1. Anchor = latest generated instance date, or the template date when none exists
 * 2. Compute the due dates after the anchor, up to today and the template's end date
 * 3. Insert them in one transaction through the write queue, skipping dates that already exist
 *
 * Running the generator again after a crash or a partial run never duplicates an instance:
 * the anchor moves forward with every committed batch and the (parent, date) unique index
 * absorbs any overlap.
 *
 * Templates without a recurrence frequency are skipped. A failure on one template stops the run;
 * templates after it are picked up by the next run.
 */
@Slf4j
@Service
public class RecurringTransactionService {

    private final TransactionRepository transactionRepository;
    private final WriteQueue writeQueue;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final int maxInstancesPerBatch;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RecurringTransactionService(TransactionRepository transactionRepository,
                                       WriteQueue writeQueue,
                                       Clock clock,
                                       MeterRegistry meterRegistry,
                                       AppProperties properties) {
        this.transactionRepository = transactionRepository;
        this.writeQueue = writeQueue;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.maxInstancesPerBatch = properties.getRecurring().getMaxInstancesPerBatch();
    }

    /**
     * Generate every due instance of every active template.
     *
     * Never throws. Blocks on the write queue, so it must not be called from inside a write
     * operation.
     */
    public RecurringRunResult processRecurringTransactions() {
        if (!running.compareAndSet(false, true)) {
            log.info("Recurring transaction processing already in progress, skipping");
            Counter.builder("recurring.run")
                    .tag("result", "skipped")
                    .register(meterRegistry)
                    .increment();
            return RecurringRunResult.skipped();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        int templatesProcessed = 0;
        int instancesCreated = 0;

        try {
            LocalDate today = LocalDate.now(clock);
            List<TransactionEntity> templates = transactionRepository.findActiveRecurringTemplates(today);
            log.debug("Found {} active recurring template(s)", templates.size());

            for (TransactionEntity template : templates) {
                if (template.getRecurrenceFrequency() == null) {
                    log.warn("Recurring template {} has no recurrence frequency, skipping", template.getId());
                    continue;
                }
                instancesCreated += generateInstances(template, today);
                templatesProcessed++;
            }

            if (instancesCreated > 0) {
                log.info("Generated {} recurring transaction instance(s) from {} template(s)",
                        instancesCreated, templatesProcessed);
            }

            Counter.builder("recurring.run")
                    .tag("result", "completed")
                    .register(meterRegistry)
                    .increment();

            return RecurringRunResult.builder()
                    .status(RecurringRunResult.Status.COMPLETED)
                    .templatesProcessed(templatesProcessed)
                    .instancesCreated(instancesCreated)
                    .build();

        } catch (Exception e) {
            Throwable cause = unwrap(e);
            log.error("Error processing recurring transactions after {} template(s): {}",
                    templatesProcessed, cause.getMessage(), cause);

            Counter.builder("recurring.run")
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();

            return RecurringRunResult.builder()
                    .status(RecurringRunResult.Status.FAILED)
                    .templatesProcessed(templatesProcessed)
                    .instancesCreated(instancesCreated)
                    .failureMessage(cause.getMessage())
                    .build();

        } finally {
            sample.stop(Timer.builder("recurring.run.duration").register(meterRegistry));
            running.set(false);
        }
    }

    private int generateInstances(TransactionEntity template, LocalDate today) {
        LocalDate anchor = transactionRepository.findLatestInstanceDate(template.getId())
                .orElse(template.getDate());

        List<LocalDate> dates = RecurrenceCalculator.calculateMissingInstances(
                template.getDate(),
                anchor,
                today,
                template.getRecurrenceFrequency(),
                template.getRecurrenceEndDate(),
                maxInstancesPerBatch
        );

        if (dates.isEmpty()) {
            return 0;
        }

        if (dates.size() == maxInstancesPerBatch) {
            log.warn("Template {} reached the batch limit of {} instances, remaining dates deferred to the next run",
                    template.getId(), maxInstancesPerBatch);
        }

        Instant createdAt = clock.instant();
        int inserted = writeQueue.enqueueWrite(
                () -> transactionRepository.insertInstancesIfAbsent(template, dates, createdAt),
                "generateRecurringInstances:" + template.getId()
        ).join();

        Counter.builder("recurring.instances.created")
                .tag("frequency", template.getRecurrenceFrequency().getCode())
                .register(meterRegistry)
                .increment(inserted);

        log.debug("Template {}: {} due date(s) after {}, {} inserted",
                template.getId(), dates.size(), anchor, inserted);
        return inserted;
    }

    /**
     * Stop generating instances for a template. Instances already created are kept.
     *
     * @return future completing with {@code true} when the template existed
     */
    public CompletableFuture<Boolean> cancelRecurringTransaction(long templateId) {
        LocalDate today = LocalDate.now(clock);
        return writeQueue.enqueueWrite(
                () -> transactionRepository.cancelRecurrence(templateId, today) > 0,
                "cancelRecurringTransaction:" + templateId
        ).whenComplete((changed, error) -> {
            if (error == null) {
                log.info("Cancelled recurring transaction {} (found: {})", templateId, changed);
            }
        });
    }

    /**
     * Change the schedule of a template. A null {@code endDate} removes the end date.
     *
     * @return future completing with {@code true} when the template existed
     */
    public CompletableFuture<Boolean> updateRecurringTransaction(long templateId,
                                                                 RecurrenceFrequency frequency,
                                                                 LocalDate endDate) {
        if (frequency == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Recurrence frequency is required"));
        }
        return writeQueue.enqueueWrite(
                () -> transactionRepository.updateRecurrence(templateId, frequency, endDate) > 0,
                "updateRecurringTransaction:" + templateId
        ).whenComplete((changed, error) -> {
            if (error == null) {
                log.info("Updated recurring transaction {} to {} until {} (found: {})",
                        templateId, frequency.getCode(), endDate, changed);
            }
        });
    }

    /**
     * @return future completing with the id of the new template
     */
    public CompletableFuture<Long> createRecurringTransaction(NewRecurringTransaction request) {
        try {
            validate(request);
        } catch (IllegalArgumentException e) {
            log.warn("Recurring transaction rejected: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        TransactionEntity template = TransactionEntity.builder()
                .walletId(request.getWalletId())
                .type(TransactionEntity.TransactionType.valueOf(request.getType().name()))
                .amount(request.getAmount())
                .category(request.getCategory())
                .notes(request.getNotes())
                .date(request.getDate())
                .recurring(true)
                .recurrenceFrequency(request.getFrequency())
                .recurrenceEndDate(request.getEndDate())
                .createdAt(clock.instant())
                .build();

        return writeQueue.enqueueWrite(
                () -> transactionRepository.insertTemplate(template),
                "createRecurringTransaction"
        ).whenComplete((id, error) -> {
            if (error == null) {
                log.info("Created recurring transaction {} ({} {} from {})",
                        id, request.getFrequency().getCode(), request.getAmount(), request.getDate());
            }
        });
    }

    public List<TransactionEntity> getRecurringTemplates() {
        return transactionRepository.findRecurringTemplates();
    }

    public List<TransactionEntity> getInstances(long templateId) {
        return transactionRepository.findInstances(templateId);
    }

    private static void validate(NewRecurringTransaction request) {
        if (request == null) {
            throw new IllegalArgumentException("Recurring transaction is required");
        }
        if (request.getWalletId() == null) {
            throw new IllegalArgumentException("Wallet is required");
        }
        if (request.getType() == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        if (request.getAmount() == null || request.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        if (request.getCategory() == null || request.getCategory().isBlank()) {
            throw new IllegalArgumentException("Category is required");
        }
        if (request.getDate() == null) {
            throw new IllegalArgumentException("Start date is required");
        }
        if (request.getFrequency() == null) {
            throw new IllegalArgumentException("Recurrence frequency is required");
        }
        if (request.getEndDate() != null && request.getEndDate().isBefore(request.getDate())) {
            throw new IllegalArgumentException("End date is before the start date");
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
