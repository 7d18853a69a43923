package com.fintracker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    private Database database = new Database();

    @Valid
    private WriteQueue writeQueue = new WriteQueue();

    @Valid
    private Recurring recurring = new Recurring();

    @Valid
    private Reminders reminders = new Reminders();

    @Data
    public static class Database {

        /**
         * Location of the SQLite database file
         */
        @NotBlank
        private String path = System.getProperty("user.home") + "/.finance-tracker/tracker.db";

        /**
         * How long SQLite waits on a held lock before reporting SQLITE_BUSY
         */
        @NotNull
        private Duration busyTimeout = Duration.ofSeconds(5);

        /**
         * Read connections; writes are serialized by the write queue regardless
         */
        @Min(1)
        private int maximumPoolSize = 4;
    }

    @Data
    public static class WriteQueue {

        /**
         * Retries after the first attempt, lock contention only
         */
        @Min(0)
        private int maxRetries = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(50);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        /**
         * Queue depth above which contention is reported
         */
        @Min(1)
        private int depthWarningThreshold = 5;

        /**
         * Time in queue before start above which a slow wait is reported
         */
        @NotNull
        private Duration waitWarningThreshold = Duration.ofMillis(1000);
    }

    @Data
    public static class Recurring {

        /**
         * Instances materialized per template per run; the rest wait for the next run
         */
        @Min(1)
        private int maxInstancesPerBatch = 100;

        private boolean schedulerEnabled = true;

        @NotBlank
        private String cron = "0 5 0 * * *";
    }

    @Data
    public static class Reminders {

        @NotNull
        private Duration minimumSpacing = Duration.ofHours(12);

        /**
         * Preferred delivery time used until the user picks one
         */
        @NotBlank
        private String defaultPreferredTime = "20:00";

        private String title = "Quick check-in";

        private String body = "Log today's spending. It takes 10 seconds.";
    }
}
