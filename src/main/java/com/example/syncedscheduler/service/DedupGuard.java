package com.example.syncedscheduler.service;

import com.example.syncedscheduler.config.SchedulerMetrics;
import com.example.syncedscheduler.domain.enums.FiringOutcome;
import com.example.syncedscheduler.lock.DistributedLock;
import com.example.syncedscheduler.schedule.Firing;
import com.example.syncedscheduler.store.WatermarkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.OptionalLong;

/**
 * Ensures a job action runs on at most one instance per occurrence.
 * <p>
 * Flow for every local firing:
 * 1. Acquire the lock {@code <jobName>Lock}, waiting as long as it takes
 * 2. Read the job watermark
 * 3. If the occurrence is unclaimed, write the watermark before releasing the lock
 * 4. Release the lock
 * 5. Run the action only if this instance wrote the watermark
 * <p>
 * A failing action is logged and discarded: its occurrence stays claimed and is not retried.
 * Lock and store failures propagate to the caller after the lock has been released.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DedupGuard {

    static final String LOCK_SUFFIX = "Lock";

    private final WatermarkStore watermarkStore;
    private final DistributedLock distributedLock;
    private final SchedulerMetrics metrics;
    private final Clock clock;

    /**
     * Run {@code action} for {@code firing} unless another instance already claimed it.
     *
     * @param jobName Job name, also the watermark key
     * @param firing  Occurrence this firing stands for
     * @param action  User action
     * @return Outcome of the firing on this instance
     */
    public FiringOutcome guard(String jobName, Firing firing, Runnable action) {
        var sample = metrics.startClaimTimer();
        var claimed = distributedLock.withLock(lockName(jobName), () -> claim(jobName, firing));
        metrics.recordClaim(sample, jobName, claimed);

        if (!claimed) {
            log.debug("Job {} occurrence {} already claimed, skipping", jobName, firing.getNextExecution());
            return FiringOutcome.SKIPPED;
        }

        try {
            action.run();
            log.info("Job {} executed for occurrence {}", jobName, firing.getNextExecution());
            return FiringOutcome.EXECUTED;
        } catch (Exception e) {
            log.warn("Job {} failed for occurrence {}, not retried: {}", jobName, firing.getNextExecution(), e.getMessage(), e);
            return FiringOutcome.FAILED;
        }
    }

    /**
     * Runs inside the lock. Returns true if this instance claimed the occurrence.
     */
    private boolean claim(String jobName, Firing firing) {
        var watermark = watermarkStore.get(jobName);
        if (!shouldRun(watermark, firing, clock.millis())) {
            return false;
        }
        watermarkStore.set(jobName, firing.getNextExecution());
        return true;
    }

    /**
     * Decide whether an occurrence is still unclaimed.
     * <p>
     * Recurring jobs store the occurrence after the one being fired, so a watermark in the past
     * means the current occurrence has not been claimed yet. One-off jobs always fire for the same
     * fixed timestamp, so any watermark other than that timestamp means unclaimed.
     */
    static boolean shouldRun(OptionalLong watermark, Firing firing, long now) {
        if (watermark.isEmpty()) {
            return true;
        }
        if (firing.isRecurring()) {
            return watermark.getAsLong() < now;
        }
        return watermark.getAsLong() != firing.getNextExecution();
    }

    static String lockName(String jobName) {
        return jobName + LOCK_SUFFIX;
    }
}
