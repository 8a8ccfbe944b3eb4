package com.example.syncedscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Synced Scheduler Application
 * <p>
 * Runs the same recurring and one-time jobs on every instance of the application
 * while guaranteeing that each due occurrence executes on exactly one of them.
 * <p>
 * Features:
 * - Cron, recurrence rule and fixed date schedules
 * - Distributed lock per job name backed by ShedLock
 * - Shared execution watermark persisted in PostgreSQL
 * - Local cancellation without touching other instances
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SyncedSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SyncedSchedulerApplication.class, args);
    }
}
