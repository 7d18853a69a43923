package com.fintracker.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintracker.config.AppProperties;
import com.fintracker.domain.model.ReminderGateDecision;
import com.fintracker.domain.model.ReminderGateReason;
import com.fintracker.domain.model.ReminderState;
import com.fintracker.infrastructure.persistence.queue.WriteQueue;
import com.fintracker.infrastructure.persistence.repository.JdbcSettingsRepository;
import com.fintracker.support.TestDatabase;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ReminderStateServiceTest {

    @TempDir
    Path tempDir;

    private TestDatabase database;
    private WriteQueue writeQueue;
    private JdbcSettingsRepository settingsRepository;
    private ReminderStateService service;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create(tempDir);
        writeQueue = new WriteQueue(new AppProperties.WriteQueue(), RetryRegistry.ofDefaults(), new SimpleMeterRegistry());
        settingsRepository = new JdbcSettingsRepository(database.jdbcTemplate());

        service = new ReminderStateService(
                settingsRepository,
                writeQueue,
                new ObjectMapper().findAndRegisterModules(),
                Clock.fixed(Instant.parse("2026-02-16T19:00:00Z"), ZoneOffset.UTC),
                new AppProperties()
        );
    }

    @AfterEach
    void tearDown() {
        writeQueue.close();
        database.close();
    }

    @Test
    void load_withNothingStored_returnsDefaults() {
        ReminderState state = service.load();

        assertFalse(state.isRemindersEnabled());
        assertFalse(state.isPermissionGranted());
        assertEquals("20:00", state.getPreferredTimeLocal());
        assertNull(state.getLastDeliveredAtUtc());
    }

    @Test
    void update_persistsTheWholeState() throws Exception {
        Instant delivered = Instant.parse("2026-02-16T19:00:00Z");

        service.update(state -> state.toBuilder()
                .remindersEnabled(true)
                .permissionGranted(true)
                .quietHoursStart("22:00")
                .quietHoursEnd("07:00")
                .lastDeliveredAtUtc(delivered)
                .lastDeliveredLocalDate("2026-02-16")
                .build(), "test").get(5, TimeUnit.SECONDS);

        ReminderState loaded = service.load();
        assertTrue(loaded.isRemindersEnabled());
        assertEquals("22:00", loaded.getQuietHoursStart());
        assertEquals(delivered, loaded.getLastDeliveredAtUtc());
        assertEquals("2026-02-16", loaded.getLastDeliveredLocalDate());
        assertEquals("20:00", loaded.getPreferredTimeLocal());
    }

    @Test
    void concurrentUpdates_areNotLost() throws Exception {
        List<CompletableFuture<ReminderState>> futures = new ArrayList<>();
        futures.add(service.update(state -> state.toBuilder().remindersEnabled(true).build(), "enable"));
        futures.add(service.update(state -> state.toBuilder().preferredTimeLocal("09:15").build(), "time"));
        futures.add(service.update(state -> state.toBuilder().quietHoursStart("23:00").quietHoursEnd("06:00").build(), "quiet"));

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        ReminderState loaded = service.load();
        assertTrue(loaded.isRemindersEnabled());
        assertEquals("09:15", loaded.getPreferredTimeLocal());
        assertEquals("23:00", loaded.getQuietHoursStart());
    }

    @Test
    void load_unreadableDocument_fallsBackToDefaults() {
        settingsRepository.save(ReminderStateService.SETTING_KEY, "{not json", Instant.now());

        ReminderState state = service.load();

        assertFalse(state.isRemindersEnabled());
        assertEquals("20:00", state.getPreferredTimeLocal());
    }

    @Test
    void recordDeliveryIfAllowed_storesTheDeliveryOnlyWhenAllowed() throws Exception {
        ZonedDateTime firedAt = ZonedDateTime.parse("2026-02-16T20:00:00+01:00[Europe/Berlin]");

        ReminderGateDecision blocked = service.recordDeliveryIfAllowed(
                state -> ReminderGateDecision.deny(ReminderGateReason.INSIDE_QUIET_HOURS), firedAt)
                .get(5, TimeUnit.SECONDS);

        assertFalse(blocked.isAllowed());
        assertNull(service.load().getLastDeliveredAtUtc());

        ReminderGateDecision allowed = service.recordDeliveryIfAllowed(
                state -> ReminderGateDecision.allow(), firedAt)
                .get(5, TimeUnit.SECONDS);

        assertTrue(allowed.isAllowed());
        assertEquals(firedAt.toInstant(), service.load().getLastDeliveredAtUtc());
        assertEquals("2026-02-16", service.load().getLastDeliveredLocalDate());
    }
}
