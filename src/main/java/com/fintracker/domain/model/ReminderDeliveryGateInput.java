package com.fintracker.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Snapshot checked right before a reminder is shown.
 *
 * Optional values are null when absent; a null {@code minimumSpacing} means the policy default.
 */
@Value
@Builder
public class ReminderDeliveryGateInput {

    ZonedDateTime now;
    boolean remindersEnabled;
    boolean permissionGranted;
    String quietHoursStart;
    String quietHoursEnd;
    Instant lastDeliveredAtUtc;
    String lastDeliveredLocalDate;
    Duration minimumSpacing;
}
