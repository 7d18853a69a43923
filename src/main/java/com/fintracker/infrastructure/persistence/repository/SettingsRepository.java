package com.fintracker.infrastructure.persistence.repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Key/value application settings ({@code app_settings}).
 *
 * {@link #save} must only be called from inside a write queue operation.
 */
public interface SettingsRepository {

    Optional<String> find(String key);

    void save(String key, String value, Instant updatedAt);
}
