package com.fintracker.infrastructure.persistence.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcSettingsRepository implements SettingsRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public Optional<String> find(String key) {
        return jdbcTemplate.queryForList("""
                SELECT value FROM app_settings
                WHERE setting_key = :key
                """,
                Map.of("key", key),
                String.class
            )
            .stream()
            .findFirst();
    }

    @Override
    public void save(String key, String value, Instant updatedAt) {
        int rows = jdbcTemplate.update("""
                INSERT INTO app_settings (setting_key, value, updated_at)
                VALUES (:key, :value, :updatedAt)
                ON CONFLICT (setting_key) DO UPDATE
                SET value = excluded.value, updated_at = excluded.updated_at
                """,
            new MapSqlParameterSource()
                .addValue("key", key)
                .addValue("value", value)
                .addValue("updatedAt", updatedAt.toString())
        );

        if (rows == 0) {
            throw new IllegalStateException("Failed to save setting: " + key);
        }
    }
}
