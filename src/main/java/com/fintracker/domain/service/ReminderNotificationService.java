package com.fintracker.domain.service;

import com.fintracker.config.AppProperties;
import com.fintracker.domain.model.ReminderCandidate;
import com.fintracker.domain.model.ReminderDelivery;
import com.fintracker.domain.model.ReminderDeliveryGateInput;
import com.fintracker.domain.model.ReminderEligibilityInput;
import com.fintracker.domain.model.ReminderGateDecision;
import com.fintracker.domain.model.ReminderPreferences;
import com.fintracker.domain.model.ReminderState;
import com.fintracker.infrastructure.notification.NotificationScheduler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Keeps exactly one reminder scheduled with the {@link NotificationScheduler}.
 *
 * The slot is computed ahead of time, but the device clock or zone may change before it
 * fires, so the delivery gate is evaluated again at fire time with the clock of that moment.
 *
 * Failures are logged and never thrown: a broken reminder must not break the caller.
 * Every method blocks on the write queue and must not be called from inside a write operation.
 */
@Slf4j
@Service
public class ReminderNotificationService {

    private final ReminderStateService stateService;
    private final ReminderEligibilityPolicy policy;
    private final NotificationScheduler notificationScheduler;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final AppProperties.Reminders settings;

    public ReminderNotificationService(ReminderStateService stateService,
                                       ReminderEligibilityPolicy policy,
                                       NotificationScheduler notificationScheduler,
                                       Clock clock,
                                       MeterRegistry meterRegistry,
                                       AppProperties properties) {
        this.stateService = stateService;
        this.policy = policy;
        this.notificationScheduler = notificationScheduler;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.settings = properties.getReminders();
    }

    /**
     * Replace any pending reminder with one at the next eligible slot.
     *
     * @param reason logged with the outcome
     * @return the scheduled slot, empty when reminders are off, permission is missing or
     * scheduling failed
     */
    public Optional<ReminderCandidate> scheduleNextEligibleReminder(String reason) {
        try {
            ReminderState state = stateService.load();

            if (!state.isRemindersEnabled()) {
                cancelPending("reminders_disabled", state);
                return Optional.empty();
            }

            if (!notificationScheduler.isPermissionGranted()) {
                // permission revoked outside the app; keep the stored state coherent
                stateService.update(current -> current.toBuilder()
                        .remindersEnabled(false)
                        .permissionGranted(false)
                        .build(), "disableRemindersWithoutPermission").join();
                cancelPending("permission_not_granted", state);
                return Optional.empty();
            }

            ReminderCandidate candidate = policy.computeNextEligibleReminder(ReminderEligibilityInput.builder()
                    .now(ZonedDateTime.now(clock))
                    .preferredTimeLocal(state.getPreferredTimeLocal())
                    .quietHoursStart(state.getQuietHoursStart())
                    .quietHoursEnd(state.getQuietHoursEnd())
                    .lastDeliveredAtUtc(state.getLastDeliveredAtUtc())
                    .lastDeliveredLocalDate(state.getLastDeliveredLocalDate())
                    .build());

            int cancelled = notificationScheduler.cancelPendingReminders();
            notificationScheduler.scheduleAt(candidate.getCandidateLocal(), settings.getTitle(), settings.getBody());

            stateService.update(current -> current.toBuilder()
                    .permissionGranted(true)
                    .nextScheduledAtUtc(candidate.getCandidateUtc())
                    .build(), "saveNextReminder").join();

            log.info("Scheduled next reminder for {} (reason: {}, replaced: {}, quietHoursAdjusted: {}, "
                            + "minimumSpacingApplied: {}, dailyGateApplied: {})",
                    candidate.getCandidateLocal(), reason, cancelled, candidate.isQuietHoursAdjusted(),
                    candidate.isMinimumSpacingApplied(), candidate.isDailyGateApplied());
            return Optional.of(candidate);

        } catch (Exception e) {
            log.error("Failed to schedule next reminder (reason: {}): {}", reason, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Called by the notification owner when a scheduled reminder fires.
     *
     * @return whether the reminder is shown; a suppressed reminder is rescheduled
     */
    public ReminderDelivery onReminderFired() {
        try {
            ZonedDateTime now = ZonedDateTime.now(clock);
            boolean permissionGranted = notificationScheduler.isPermissionGranted();

            ReminderGateDecision decision = stateService.recordDeliveryIfAllowed(state ->
                    policy.evaluateReminderDeliveryGate(ReminderDeliveryGateInput.builder()
                            .now(now)
                            .remindersEnabled(state.isRemindersEnabled())
                            .permissionGranted(permissionGranted)
                            .quietHoursStart(state.getQuietHoursStart())
                            .quietHoursEnd(state.getQuietHoursEnd())
                            .lastDeliveredAtUtc(state.getLastDeliveredAtUtc())
                            .lastDeliveredLocalDate(state.getLastDeliveredLocalDate())
                            .build()), now).join();

            if (!decision.isAllowed()) {
                String reason = decision.getReason().getCode();
                log.warn("Reminder delivery blocked by gate: {}", reason);
                countDelivery("suppressed", reason);
                scheduleNextEligibleReminder("delivery_gate_blocked_" + reason);
                return ReminderDelivery.SUPPRESS;
            }

            countDelivery("shown", decision.getReason().getCode());
            scheduleNextEligibleReminder("delivery_success");
            return ReminderDelivery.SHOW;

        } catch (Exception e) {
            log.error("Failed to evaluate fired reminder: {}", e.getMessage(), e);
            countDelivery("suppressed", "error");
            return ReminderDelivery.SUPPRESS;
        }
    }

    /**
     * Store new reminder settings and reschedule accordingly.
     *
     * @throws IllegalArgumentException when a time is not a valid HH:MM value
     */
    public Optional<ReminderCandidate> updatePreferences(ReminderPreferences preferences) {
        ReminderEligibilityPolicy.parseTimeLocal(preferences.getPreferredTimeLocal());
        QuietHoursWindow.parse(preferences.getQuietHoursStart(), preferences.getQuietHoursEnd());

        try {
            stateService.update(current -> current.toBuilder()
                    .remindersEnabled(preferences.isRemindersEnabled())
                    .preferredTimeLocal(preferences.getPreferredTimeLocal())
                    .quietHoursStart(preferences.getQuietHoursStart())
                    .quietHoursEnd(preferences.getQuietHoursEnd())
                    .build(), "updateReminderPreferences").join();
        } catch (Exception e) {
            log.error("Failed to save reminder preferences: {}", e.getMessage(), e);
            return Optional.empty();
        }

        return scheduleNextEligibleReminder(preferences.isRemindersEnabled() ? "user_enabled" : "user_disabled");
    }

    private void cancelPending(String reason, ReminderState state) {
        int cancelled = notificationScheduler.cancelPendingReminders();
        if (state.getNextScheduledAtUtc() != null) {
            stateService.update(current -> current.toBuilder()
                    .nextScheduledAtUtc(null)
                    .build(), "clearNextReminder").join();
        }
        log.info("Cancelled {} scheduled reminder(s): {}", cancelled, reason);
    }

    private void countDelivery(String result, String reason) {
        Counter.builder("reminder.delivery")
                .tag("result", result)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }
}
