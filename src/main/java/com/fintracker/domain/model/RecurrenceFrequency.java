package com.fintracker.domain.model;

import java.time.LocalDate;
import java.util.Arrays;

/**
 * How far apart two instances of a recurring template are.
 *
 * Month and year steps follow calendar arithmetic: a step that lands past the end of a
 * shorter month is clamped to that month's last day.
 */
public enum RecurrenceFrequency {

    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    YEARLY("yearly");

    private final String code;

    RecurrenceFrequency(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @return {@code date} moved forward by {@code periods} whole periods
     */
    public LocalDate advance(LocalDate date, long periods) {
        switch (this) {
            case DAILY:
                return date.plusDays(periods);
            case WEEKLY:
                return date.plusWeeks(periods);
            case MONTHLY:
                return date.plusMonths(periods);
            case YEARLY:
                return date.plusYears(periods);
            default:
                throw new IllegalStateException("Unhandled frequency " + this);
        }
    }

    public static RecurrenceFrequency fromCode(String code) {
        return Arrays.stream(values())
                .filter(frequency -> frequency.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown recurrence frequency: " + code));
    }
}
