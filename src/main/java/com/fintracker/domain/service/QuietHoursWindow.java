package com.fintracker.domain.service;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Local time-of-day window in which no reminder is delivered. Start is inclusive, end exclusive.
 * The window wraps midnight when start is after end (21:00-07:00).
 */
final class QuietHoursWindow {

    private final LocalTime start;
    private final LocalTime end;

    private QuietHoursWindow(LocalTime start, LocalTime end) {
        this.start = start;
        this.end = end;
    }

    /**
     * @return empty when either bound is missing, or when both are equal (a full-day
     * lockout is never intended)
     */
    static Optional<QuietHoursWindow> parse(String start, String end) {
        if (start == null || start.isBlank() || end == null || end.isBlank()) {
            return Optional.empty();
        }
        LocalTime startTime = ReminderEligibilityPolicy.parseTimeLocal(start);
        LocalTime endTime = ReminderEligibilityPolicy.parseTimeLocal(end);
        if (startTime.equals(endTime)) {
            return Optional.empty();
        }
        return Optional.of(new QuietHoursWindow(startTime, endTime));
    }

    boolean wrapsMidnight() {
        return start.isAfter(end);
    }

    boolean contains(LocalTime time) {
        LocalTime value = time.truncatedTo(ChronoUnit.MINUTES);
        if (!wrapsMidnight()) {
            return !value.isBefore(start) && value.isBefore(end);
        }
        return !value.isBefore(start) || value.isBefore(end);
    }

    /**
     * @return {@code candidate} unchanged when outside the window, otherwise the end of the
     * window it falls in
     */
    ZonedDateTime moveToEnd(ZonedDateTime candidate) {
        LocalTime time = candidate.toLocalTime();
        if (!contains(time)) {
            return candidate;
        }
        // late part of a wrapping window ends tomorrow
        if (wrapsMidnight() && !time.truncatedTo(ChronoUnit.MINUTES).isBefore(start)) {
            return ReminderEligibilityPolicy.atLocalTime(candidate.toLocalDate().plusDays(1), end, candidate.getZone());
        }
        return ReminderEligibilityPolicy.atLocalTime(candidate.toLocalDate(), end, candidate.getZone());
    }
}
