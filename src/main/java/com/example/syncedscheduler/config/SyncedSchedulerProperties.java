package com.example.syncedscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for the synced scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "synced-scheduler")
public class SyncedSchedulerProperties {

    /**
     * Number of local timer threads. A firing blocks its thread while waiting for the job lock.
     */
    @Min(1)
    private int schedulerPoolSize = 10;

    @NotBlank
    private String threadNamePrefix = "synced-job-";

    /**
     * Zone used to evaluate cron expressions and recurrence rules
     */
    @NotNull
    private ZoneId zone = ZoneId.systemDefault();

    /**
     * How long a held lock record stays valid before another instance may take it over
     */
    @NotNull
    private Duration lockAtMostFor = Duration.ofMinutes(10);

    /**
     * Pause between attempts while another instance holds the job lock
     */
    @NotNull
    private Duration lockPollInterval = Duration.ofMillis(100);

    @NotBlank
    private String lockTableName = "shedlock";
}
