package com.fintracker.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Next slot at which a reminder may be delivered.
 *
 * {@code candidateLocalDate} is the day-bucket key the caller stores once the reminder is delivered.
 */
@Value
@Builder
public class ReminderCandidate {

    ZonedDateTime candidateLocal;
    Instant candidateUtc;
    String candidateLocalDate;
    boolean minimumSpacingApplied;
    boolean dailyGateApplied;
    boolean quietHoursAdjusted;
}
