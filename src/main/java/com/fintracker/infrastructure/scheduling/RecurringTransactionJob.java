package com.fintracker.infrastructure.scheduling;

import com.fintracker.domain.model.RecurringRunResult;
import com.fintracker.domain.service.RecurringTransactionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the recurring transaction generator once the application is up, then daily.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.recurring", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class RecurringTransactionJob {

    private final RecurringTransactionService recurringTransactionService;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        run("startup");
    }

    @Scheduled(cron = "${app.recurring.cron:0 5 0 * * *}")
    public void onSchedule() {
        run("schedule");
    }

    private void run(String trigger) {
        RecurringRunResult result = recurringTransactionService.processRecurringTransactions();
        log.debug("Recurring run ({}) finished: {}", trigger, result);
    }
}
