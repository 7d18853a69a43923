package com.fintracker.domain.service;

import com.fintracker.domain.model.RecurrenceFrequency;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Date arithmetic of recurring templates.
 *
 * Occurrences are stepped forward from the anchor by whole periods. When the anchor is one
 * of the template's own occurrences, steps are counted from the template date instead
 * ({@code templateDate + k periods}), so a monthly template dated the 31st yields
 * Jan 31, Feb 28/29, Mar 31, ... instead of drifting to the 28th. An anchor off that grid,
 * left behind by a frequency change, starts a new grid of its own.
 */
public final class RecurrenceCalculator {

    private RecurrenceCalculator() {
    }

    /**
     * Occurrences strictly after {@code anchor}, up to and including {@code today} and
     * {@code endDate} (when set), in ascending order.
     *
     * @param templateDate first occurrence of the template
     * @param anchor       latest date already materialized, or the template date
     * @param limit        maximum number of dates returned; the rest are left for a later call
     */
    public static List<LocalDate> calculateMissingInstances(LocalDate templateDate,
                                                            LocalDate anchor,
                                                            LocalDate today,
                                                            RecurrenceFrequency frequency,
                                                            LocalDate endDate,
                                                            int limit) {
        List<LocalDate> dates = new ArrayList<>();
        if (limit <= 0) {
            return dates;
        }

        LocalDate origin = anchor;
        long offset = periodsToAnchor(templateDate, anchor, frequency);
        if (offset >= 0) {
            origin = templateDate;
        } else {
            offset = 0;
        }

        for (long k = offset + 1; ; k++) {
            LocalDate next = frequency.advance(origin, k);
            if (next.isAfter(today) || (endDate != null && next.isAfter(endDate))) {
                break;
            }
            dates.add(next);
            if (dates.size() >= limit) {
                break;
            }
        }
        return dates;
    }

    /**
     * @return {@code k} such that {@code templateDate + k periods} is the anchor, or -1 when
     * the anchor is not an occurrence of the template
     */
    static long periodsToAnchor(LocalDate templateDate, LocalDate anchor, RecurrenceFrequency frequency) {
        for (long k = 0; ; k++) {
            LocalDate occurrence = frequency.advance(templateDate, k);
            if (occurrence.isEqual(anchor)) {
                return k;
            }
            if (occurrence.isAfter(anchor)) {
                return -1;
            }
        }
    }
}
