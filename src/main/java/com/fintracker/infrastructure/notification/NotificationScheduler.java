package com.fintracker.infrastructure.notification;

import java.time.ZonedDateTime;

/**
 * Owner of the platform alarm that eventually shows the reminder.
 *
 * Implementations call back into
 * {@link com.fintracker.domain.service.ReminderNotificationService#onReminderFired()} when a
 * scheduled reminder fires.
 */
public interface NotificationScheduler {

    void scheduleAt(ZonedDateTime triggerAt, String title, String body);

    /**
     * @return number of pending reminders removed
     */
    int cancelPendingReminders();

    boolean isPermissionGranted();
}
