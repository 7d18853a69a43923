package com.fintracker.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintracker.config.AppProperties;
import com.fintracker.domain.model.ReminderGateDecision;
import com.fintracker.domain.model.ReminderState;
import com.fintracker.infrastructure.persistence.queue.WriteQueue;
import com.fintracker.infrastructure.persistence.repository.SettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Persists {@link ReminderState} as one JSON document in {@code app_settings}.
 *
 * Reads run on the caller's thread. Updates are read-modify-write operations executed
 * entirely inside the write queue, so two concurrent updates never overwrite each other.
 */
@Slf4j
@Service
public class ReminderStateService {

    static final String SETTING_KEY = "reminder_state";

    private final SettingsRepository settingsRepository;
    private final WriteQueue writeQueue;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AppProperties.Reminders defaults;

    public ReminderStateService(SettingsRepository settingsRepository,
                                WriteQueue writeQueue,
                                ObjectMapper objectMapper,
                                Clock clock,
                                AppProperties properties) {
        this.settingsRepository = settingsRepository;
        this.writeQueue = writeQueue;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaults = properties.getReminders();
    }

    /**
     * @return the stored state, or the defaults (reminders off) when nothing is stored yet
     * or the stored document cannot be read
     */
    public ReminderState load() {
        return settingsRepository.find(SETTING_KEY)
                .map(this::readOrDefault)
                .orElseGet(this::defaultState);
    }

    /**
     * Apply {@code change} to the current state and store the result.
     *
     * @return future completing with the stored state
     */
    public CompletableFuture<ReminderState> update(UnaryOperator<ReminderState> change, String operationName) {
        return writeQueue.enqueueWrite(() -> save(change.apply(load())), operationName);
    }

    /**
     * Evaluate {@code gate} against the current state and, when it allows delivery, record
     * the delivery at {@code deliveredAt}. Both steps run as one write operation, so of two
     * concurrent calls on the same local day at most one is allowed.
     *
     * @return future completing with the gate decision
     */
    public CompletableFuture<ReminderGateDecision> recordDeliveryIfAllowed(
            Function<ReminderState, ReminderGateDecision> gate,
            ZonedDateTime deliveredAt) {
        return writeQueue.enqueueWrite(() -> {
            ReminderState current = load();
            ReminderGateDecision decision = gate.apply(current);
            if (decision.isAllowed()) {
                save(current.toBuilder()
                        .lastDeliveredAtUtc(deliveredAt.toInstant())
                        .lastDeliveredLocalDate(ReminderEligibilityPolicy.formatLocalDate(deliveredAt))
                        .nextScheduledAtUtc(null)
                        .build());
            }
            return decision;
        }, "recordReminderDelivery");
    }

    private ReminderState save(ReminderState state) throws JsonProcessingException {
        settingsRepository.save(SETTING_KEY, objectMapper.writeValueAsString(state), clock.instant());
        return state;
    }

    private ReminderState readOrDefault(String json) {
        try {
            ReminderState state = objectMapper.readValue(json, ReminderState.class);
            if (state.getPreferredTimeLocal() == null) {
                state.setPreferredTimeLocal(defaults.getDefaultPreferredTime());
            }
            return state;
        } catch (JsonProcessingException e) {
            log.warn("Stored reminder state is unreadable, falling back to defaults: {}", e.getOriginalMessage());
            return defaultState();
        }
    }

    private ReminderState defaultState() {
        return ReminderState.builder()
                .remindersEnabled(false)
                .permissionGranted(false)
                .preferredTimeLocal(defaults.getDefaultPreferredTime())
                .build();
    }
}
