package com.example.syncedscheduler.config;

import com.example.syncedscheduler.domain.enums.FiringOutcome;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Metrics for monitoring job firings across the fleet.
 * <p>
 * Exposes Prometheus metrics for:
 * - Firing outcomes per job (executed, skipped, failed, error)
 * - Time spent waiting for the job lock and claiming the occurrence
 * - Jobs registered on this instance
 */
@Component
@RequiredArgsConstructor
public class SchedulerMetrics {

    private final MeterRegistry meterRegistry;

    /**
     * Register the gauge reporting how many jobs this instance has registered
     */
    public void registerJobCountGauge(Supplier<Number> jobCount) {
        Gauge.builder("synced_scheduler_registered_jobs", jobCount)
                .description("Number of jobs registered on this instance")
                .register(meterRegistry);
    }

    /**
     * Start timing a claim attempt
     */
    public Timer.Sample startClaimTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record time spent acquiring the lock and checking the watermark
     */
    public void recordClaim(Timer.Sample sample, String jobName, boolean claimed) {
        sample.stop(Timer.builder("synced_scheduler_claim_time")
                .tag("job", jobName)
                .tag("claimed", String.valueOf(claimed))
                .description("Lock wait plus watermark check per firing")
                .register(meterRegistry));
    }

    /**
     * Record the outcome of one local firing
     */
    public void recordFiring(String jobName, FiringOutcome outcome) {
        meterRegistry.counter("synced_scheduler_firings",
                "job", jobName,
                "outcome", outcome.getCode()
        ).increment();
    }
}
