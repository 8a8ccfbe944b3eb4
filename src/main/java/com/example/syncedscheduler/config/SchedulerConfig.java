package com.example.syncedscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Configuration for the local timer that drives job firings on this instance.
 * <p>
 * Each instance owns one timer. Firings of the same job on different instances
 * are coordinated by the job lock, not by the timer.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean(name = "syncedJobTaskScheduler")
    public ThreadPoolTaskScheduler syncedJobTaskScheduler(SyncedSchedulerProperties properties) {
        log.info("Creating local job timer with {} threads", properties.getSchedulerPoolSize());

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix(properties.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.error("Unhandled error in job firing: {}", t.getMessage(), t));
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);

        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
