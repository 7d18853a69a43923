package com.fintracker.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Snapshot used to pick the next reminder slot. The zone of {@code now} is the device zone.
 */
@Value
@Builder
public class ReminderEligibilityInput {

    ZonedDateTime now;
    String preferredTimeLocal;
    String quietHoursStart;
    String quietHoursEnd;
    Instant lastDeliveredAtUtc;
    String lastDeliveredLocalDate;
    Duration minimumSpacing;
}
