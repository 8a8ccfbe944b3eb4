package com.example.syncedscheduler.service;

import com.example.syncedscheduler.config.SchedulerMetrics;
import com.example.syncedscheduler.config.SyncedSchedulerProperties;
import com.example.syncedscheduler.domain.enums.FiringOutcome;
import com.example.syncedscheduler.exception.InvalidJobSpecException;
import com.example.syncedscheduler.exception.JobNotFoundException;
import com.example.syncedscheduler.schedule.JobSpec;
import com.example.syncedscheduler.schedule.JobSpecs;
import com.example.syncedscheduler.schedule.OneOffJobSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for registering jobs that must run once across all instances.
 * <p>
 * Every instance registers the same jobs. Each registration:
 * 1. Resolves the schedule shape (cron, recurrence rule or date) once
 * 2. Wraps the action so every firing computes its occurrence and goes through {@link DedupGuard}
 * 3. Hands the wrapped action to the local timer
 * <p>
 * Registering a name that is already registered on this instance replaces the earlier
 * registration. Names are not checked across instances.
 */
@Slf4j
@Service
public class SyncedScheduler {

    /**
     * Matches {@code job_watermarks.job_name}. The lock name adds {@link DedupGuard#LOCK_SUFFIX}
     * and must fit {@code shedlock.name}.
     */
    static final int MAX_JOB_NAME_LENGTH = 200;

    private final DedupGuard dedupGuard;
    private final TaskScheduler taskScheduler;
    private final SyncedSchedulerProperties properties;
    private final SchedulerMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, JobHandle> jobs = new ConcurrentHashMap<>();

    public SyncedScheduler(DedupGuard dedupGuard, @Qualifier("syncedJobTaskScheduler") TaskScheduler taskScheduler,
                           SyncedSchedulerProperties properties, SchedulerMetrics metrics, Clock clock) {
        this.dedupGuard = dedupGuard;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        metrics.registerJobCountGauge(jobs::size);
    }

    /**
     * Register a job on this instance.
     *
     * @param jobName Name of the job, identical on every instance
     * @param spec    Cron expression ({@link String}), {@link com.example.syncedscheduler.schedule.RecurrenceRule},
     *                date ({@link java.time.Instant}, {@link java.util.Date}, {@link ZonedDateTime},
     *                {@link java.time.OffsetDateTime}) or a {@link JobSpec}
     * @param action  Code to run once per occurrence across all instances
     * @return Handle to cancel local firings. For a date that has already passed the handle is
     * done and nothing is registered.
     * @throws InvalidJobSpecException if the name, schedule or action is invalid
     */
    public JobHandle scheduleJob(String jobName, Object spec, Runnable action) {
        if (jobName == null || jobName.isBlank()) {
            throw new InvalidJobSpecException(String.valueOf(jobName), "job name is required");
        }
        if (jobName.length() > MAX_JOB_NAME_LENGTH) {
            throw new InvalidJobSpecException(jobName,
                    "job name is " + jobName.length() + " characters, at most " + MAX_JOB_NAME_LENGTH + " allowed");
        }
        if (action == null) {
            throw new InvalidJobSpecException(jobName, "action is required");
        }

        var jobSpec = JobSpecs.from(jobName, spec);
        if (jobSpec instanceof OneOffJobSpec oneOff && !oneOff.getDate().isAfter(clock.instant())) {
            log.warn("Job {} not registered, date {} has already passed", jobName, oneOff.getDate());
            return JobHandle.expired(jobName, jobSpec, clock.instant());
        }

        Runnable wrappedAction = () -> fire(jobName, jobSpec, action);
        var future = jobSpec.schedule(taskScheduler, wrappedAction, properties.getZone());
        if (future == null) {
            throw new InvalidJobSpecException(jobName, "schedule " + jobSpec.describe() + " has no future occurrence");
        }

        var handle = new JobHandle(jobName, jobSpec, clock.instant(), future, this::unregister);
        var previous = jobs.put(jobName, handle);
        if (previous != null) {
            log.warn("Job {} was already registered on this instance, replacing {} with {}",
                    jobName, previous.getSpec().describe(), jobSpec.describe());
            previous.cancel();
        }

        log.info("Registered {} job {} with schedule {}", jobSpec.getKind().getCode(), jobName, jobSpec.describe());
        return handle;
    }

    /**
     * Run one local firing of a job. Never throws.
     */
    FiringOutcome fire(String jobName, JobSpec jobSpec, Runnable action) {
        FiringOutcome outcome;
        try {
            var now = ZonedDateTime.now(clock).withZoneSameInstant(properties.getZone());
            var firing = jobSpec.nextFiring(now);
            outcome = dedupGuard.guard(jobName, firing, action);
        } catch (Exception e) {
            log.error("Firing of job {} abandoned: {}", jobName, e.getMessage(), e);
            outcome = FiringOutcome.ERROR;
        }
        metrics.recordFiring(jobName, outcome);
        return outcome;
    }

    public Optional<JobHandle> getJob(String jobName) {
        return Optional.ofNullable(jobs.get(jobName));
    }

    /**
     * Get jobs registered on this instance, ordered by name
     */
    public List<JobHandle> getJobs() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(JobHandle::getName))
                .toList();
    }

    /**
     * Cancel local firings of a job
     *
     * @throws JobNotFoundException if the job is not registered on this instance
     */
    public JobHandle cancelJob(String jobName) {
        var handle = getJob(jobName).orElseThrow(() -> new JobNotFoundException(jobName));
        handle.cancel();
        return handle;
    }

    private void unregister(JobHandle handle) {
        if (jobs.remove(handle.getName(), handle)) {
            log.info("Cancelled job {} on this instance", handle.getName());
        }
    }
}
