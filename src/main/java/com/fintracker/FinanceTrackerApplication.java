package com.fintracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Local persistence and scheduling core of the finance tracker.
 *
 * Architecture:
 * - Embedded SQLite database, single on-device writer
 * - Write queue serializing every mutation (FIFO, retry on lock contention)
 * - Recurring transaction generator (idempotent, bounded per run)
 * - Reminder eligibility gate (pure policy, consulted at schedule time and fire time)
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableTransactionManagement
@EnableScheduling
public class FinanceTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinanceTrackerApplication.class, args);
    }
}
