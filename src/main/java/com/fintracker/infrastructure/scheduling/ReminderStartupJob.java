package com.fintracker.infrastructure.scheduling;

import com.fintracker.domain.service.ReminderNotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Re-arms the reminder on start: a pending platform alarm may not have survived a restart.
 */
@Component
@RequiredArgsConstructor
public class ReminderStartupJob {

    private final ReminderNotificationService reminderNotificationService;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        reminderNotificationService.scheduleNextEligibleReminder("startup");
    }
}
