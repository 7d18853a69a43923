package com.fintracker.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one pass of the recurring transaction generator.
 */
@Value
@Builder
public class RecurringRunResult {

    Status status;
    int templatesProcessed;
    int instancesCreated;
    String failureMessage;

    public enum Status {
        COMPLETED,
        /** Another run was in progress; nothing was done. */
        SKIPPED,
        /** Stopped at the first failing template; later templates wait for the next run. */
        FAILED
    }

    public static RecurringRunResult skipped() {
        return RecurringRunResult.builder()
                .status(Status.SKIPPED)
                .build();
    }
}
