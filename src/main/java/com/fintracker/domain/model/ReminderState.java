package com.fintracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted reminder settings and delivery bookkeeping.
 *
 * The last delivery is kept twice on purpose: {@code lastDeliveredAtUtc} drives the
 * minimum spacing between reminders, {@code lastDeliveredLocalDate} (YYYY-MM-DD in the
 * device zone at delivery time) drives the one-per-day cap. Neither is derived from the other.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReminderState {

    private boolean remindersEnabled;
    private boolean permissionGranted;

    /** HH:MM, device local time */
    private String preferredTimeLocal;

    private String quietHoursStart;
    private String quietHoursEnd;

    private Instant lastDeliveredAtUtc;
    private String lastDeliveredLocalDate;

    private Instant nextScheduledAtUtc;
}
