package com.fintracker.infrastructure.notification;

import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fallback used when no platform scheduler is registered: records the single pending slot
 * and logs it. Permission is always granted.
 */
@Slf4j
public class LoggingNotificationScheduler implements NotificationScheduler {

    private final AtomicReference<ZonedDateTime> pending = new AtomicReference<>();

    @Override
    public void scheduleAt(ZonedDateTime triggerAt, String title, String body) {
        pending.set(triggerAt);
        log.info("Reminder \"{}\" scheduled for {}", title, triggerAt);
    }

    @Override
    public int cancelPendingReminders() {
        return pending.getAndSet(null) != null ? 1 : 0;
    }

    @Override
    public boolean isPermissionGranted() {
        return true;
    }

    public Optional<ZonedDateTime> getPendingReminder() {
        return Optional.ofNullable(pending.get());
    }
}
