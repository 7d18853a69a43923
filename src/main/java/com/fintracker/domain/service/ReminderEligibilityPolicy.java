package com.fintracker.domain.service;

import com.fintracker.config.AppProperties;
import com.fintracker.domain.model.ReminderCandidate;
import com.fintracker.domain.model.ReminderDeliveryGateInput;
import com.fintracker.domain.model.ReminderEligibilityInput;
import com.fintracker.domain.model.ReminderGateDecision;
import com.fintracker.domain.model.ReminderGateReason;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides when the daily "log your spending" reminder may fire.
 *
 * Two separate rules limit delivery and neither replaces the other:
 * - spacing: at least {@code minimumSpacing} (12h by default) of absolute time between two
 *   deliveries, computed on UTC instants so a timezone or DST change cannot shorten it
 * - daily cap: at most one delivery per local calendar day, keyed by the YYYY-MM-DD string
 *   recorded at delivery time
 *
 * Pure and stateless: every input comes from the caller, including the current time.
 */
@Component
public class ReminderEligibilityPolicy {

    public static final Duration DEFAULT_MINIMUM_SPACING = Duration.ofHours(12);

    private static final int MAX_DAILY_GATE_ITERATIONS = 10;
    private static final Pattern TIME_LOCAL = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    private final Duration defaultMinimumSpacing;

    public ReminderEligibilityPolicy() {
        this(DEFAULT_MINIMUM_SPACING);
    }

    @Autowired
    public ReminderEligibilityPolicy(AppProperties properties) {
        this(properties.getReminders().getMinimumSpacing());
    }

    private ReminderEligibilityPolicy(Duration defaultMinimumSpacing) {
        this.defaultMinimumSpacing = defaultMinimumSpacing;
    }

    /**
     * Precondition check run right before a reminder is shown, with the clock of that moment.
     */
    public ReminderGateDecision evaluateReminderDeliveryGate(ReminderDeliveryGateInput input) {
        if (!input.isRemindersEnabled()) {
            return ReminderGateDecision.deny(ReminderGateReason.DISABLED);
        }

        if (!input.isPermissionGranted()) {
            return ReminderGateDecision.deny(ReminderGateReason.PERMISSION_DENIED);
        }

        ZonedDateTime now = input.getNow();
        String lastDeliveredLocalDate = input.getLastDeliveredLocalDate();
        if (lastDeliveredLocalDate != null && lastDeliveredLocalDate.equals(formatLocalDate(now))) {
            return ReminderGateDecision.deny(ReminderGateReason.SAME_LOCAL_DAY);
        }

        Instant lastDeliveredAt = input.getLastDeliveredAtUtc();
        Duration spacing = spacingOrDefault(input.getMinimumSpacing());
        if (lastDeliveredAt != null && now.toInstant().isBefore(lastDeliveredAt.plus(spacing))) {
            return ReminderGateDecision.deny(ReminderGateReason.SPACING_NOT_ELAPSED);
        }

        Optional<QuietHoursWindow> quietHours = QuietHoursWindow.parse(input.getQuietHoursStart(), input.getQuietHoursEnd());
        if (quietHours.isPresent() && quietHours.get().contains(now.toLocalTime())) {
            return ReminderGateDecision.deny(ReminderGateReason.INSIDE_QUIET_HOURS);
        }

        return ReminderGateDecision.allow();
    }

    /**
     * Next slot at which a reminder may be scheduled.
     *
     * Starts from the next occurrence of the preferred time and only ever moves later:
     * out of quiet hours, past the spacing floor, and off the day of the last delivery.
     * When the spacing floor passes the preferred time, the reminder slips to the next
     * preferred-time occurrence rather than to the bare floor, so it keeps firing at one
     * consistent time of day.
     */
    public ReminderCandidate computeNextEligibleReminder(ReminderEligibilityInput input) {
        ZonedDateTime now = input.getNow();
        ZoneId zone = now.getZone();
        LocalTime preferredTime = parseTimeLocal(input.getPreferredTimeLocal());
        Optional<QuietHoursWindow> quietHours = QuietHoursWindow.parse(input.getQuietHoursStart(), input.getQuietHoursEnd());

        ZonedDateTime spacingFloor = input.getLastDeliveredAtUtc() != null
                ? input.getLastDeliveredAtUtc().plus(spacingOrDefault(input.getMinimumSpacing())).atZone(zone)
                : null;

        boolean minimumSpacingApplied = false;
        boolean dailyGateApplied = false;
        boolean quietHoursAdjusted = false;

        ZonedDateTime candidate = atLocalTime(now.toLocalDate(), preferredTime, zone);
        if (!candidate.isAfter(now)) {
            candidate = atLocalTime(now.toLocalDate().plusDays(1), preferredTime, zone);
        }

        ZonedDateTime shifted = moveOutOfQuietHours(candidate, quietHours);
        quietHoursAdjusted = !shifted.equals(candidate);
        candidate = shifted;

        ZonedDateTime spaced = applySpacing(candidate, spacingFloor, preferredTime);
        if (!spaced.equals(candidate)) {
            minimumSpacingApplied = true;
            candidate = spaced;
            shifted = moveOutOfQuietHours(candidate, quietHours);
            quietHoursAdjusted |= !shifted.equals(candidate);
            candidate = shifted;
        }

        String lastDeliveredLocalDate = input.getLastDeliveredLocalDate();
        int iterations = 0;
        while (lastDeliveredLocalDate != null
                && lastDeliveredLocalDate.equals(formatLocalDate(candidate))
                && iterations < MAX_DAILY_GATE_ITERATIONS) {
            dailyGateApplied = true;
            candidate = atLocalTime(candidate.toLocalDate().plusDays(1), preferredTime, zone);

            spaced = applySpacing(candidate, spacingFloor, preferredTime);
            if (!spaced.equals(candidate)) {
                minimumSpacingApplied = true;
                candidate = spaced;
            }
            shifted = moveOutOfQuietHours(candidate, quietHours);
            quietHoursAdjusted |= !shifted.equals(candidate);
            candidate = shifted;

            iterations++;
        }

        return ReminderCandidate.builder()
                .candidateLocal(candidate)
                .candidateUtc(candidate.toInstant())
                .candidateLocalDate(formatLocalDate(candidate))
                .minimumSpacingApplied(minimumSpacingApplied)
                .dailyGateApplied(dailyGateApplied)
                .quietHoursAdjusted(quietHoursAdjusted)
                .build();
    }

    private static ZonedDateTime applySpacing(ZonedDateTime candidate, ZonedDateTime spacingFloor, LocalTime preferredTime) {
        if (spacingFloor == null || !candidate.isBefore(spacingFloor)) {
            return candidate;
        }
        ZonedDateTime slipped = atLocalTime(spacingFloor.toLocalDate(), preferredTime, spacingFloor.getZone());
        if (slipped.isBefore(spacingFloor)) {
            slipped = atLocalTime(spacingFloor.toLocalDate().plusDays(1), preferredTime, spacingFloor.getZone());
        }
        return slipped;
    }

    private static ZonedDateTime moveOutOfQuietHours(ZonedDateTime candidate, Optional<QuietHoursWindow> quietHours) {
        return quietHours.map(window -> window.moveToEnd(candidate)).orElse(candidate);
    }

    private Duration spacingOrDefault(Duration minimumSpacing) {
        return minimumSpacing != null ? minimumSpacing : defaultMinimumSpacing;
    }

    /**
     * Parse an {@code HH:MM} local time.
     *
     * @throws IllegalArgumentException when the value is not a valid 24h time
     */
    public static LocalTime parseTimeLocal(String timeLocal) {
        if (timeLocal == null) {
            throw new IllegalArgumentException("Invalid time format \"null\". Expected HH:MM.");
        }
        Matcher matcher = TIME_LOCAL.matcher(timeLocal.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid time format \"" + timeLocal + "\". Expected HH:MM.");
        }
        int hours = Integer.parseInt(matcher.group(1));
        int minutes = Integer.parseInt(matcher.group(2));
        if (hours > 23 || minutes > 59) {
            throw new IllegalArgumentException("Invalid time format \"" + timeLocal + "\". Expected HH:MM.");
        }
        return LocalTime.of(hours, minutes);
    }

    /**
     * Day-bucket key of the daily cap. Never used for spacing arithmetic.
     */
    public static String formatLocalDate(ZonedDateTime dateTime) {
        return formatLocalDate(dateTime.toLocalDate());
    }

    public static String formatLocalDate(LocalDate date) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    /**
     * {@code time} on {@code date} in {@code zone}; a time skipped by a DST gap resolves
     * to the instant right after the gap.
     */
    static ZonedDateTime atLocalTime(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(date, time, zone);
    }
}
