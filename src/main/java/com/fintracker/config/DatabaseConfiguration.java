package com.fintracker.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.sqlite.SQLiteConfig;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Embedded SQLite database.
 *
 * WAL journal so readers never block the single writer, and a busy timeout so a
 * briefly held lock is waited out by the driver before SQLITE_BUSY reaches the write queue.
 */
@Slf4j
@Configuration
public class DatabaseConfiguration {

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(AppProperties properties) {
        return sqliteDataSource(properties.getDatabase());
    }

    @Bean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    public static HikariDataSource sqliteDataSource(AppProperties.Database settings) {
        Path databaseFile = Path.of(settings.getPath()).toAbsolutePath();
        try {
            Files.createDirectories(databaseFile.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create database directory for " + databaseFile, e);
        }

        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqliteConfig.setBusyTimeout((int) settings.getBusyTimeout().toMillis());
        sqliteConfig.enforceForeignKeys(true);

        HikariConfig config = new HikariConfig();
        config.setPoolName("tracker-sqlite");
        config.setDriverClassName("org.sqlite.JDBC");
        config.setJdbcUrl("jdbc:sqlite:" + databaseFile);
        config.setMaximumPoolSize(settings.getMaximumPoolSize());
        config.setMinimumIdle(1);
        config.setDataSourceProperties(sqliteConfig.toProperties());

        log.info("Opening SQLite database at {} (busy timeout {}ms)",
                databaseFile, settings.getBusyTimeout().toMillis());
        return new HikariDataSource(config);
    }
}
