package com.example.syncedscheduler.service;

import com.example.syncedscheduler.schedule.JobSpec;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A job registered with the local timer of this instance.
 * <p>
 * Cancelling stops future local firings only. The shared watermark and the
 * registrations of other instances are left untouched, and a firing already
 * in progress completes normally.
 * <p>
 * A one-off job whose date had already passed at registration gets a handle that
 * is done from the start.
 */
@Getter
public class JobHandle {

    private final String name;
    private final JobSpec spec;
    private final Instant registeredAt;

    @Getter(AccessLevel.NONE)
    private final ScheduledFuture<?> future;

    @Getter(AccessLevel.NONE)
    private final Consumer<JobHandle> onCancel;

    JobHandle(String name, JobSpec spec, Instant registeredAt, ScheduledFuture<?> future, Consumer<JobHandle> onCancel) {
        this.name = name;
        this.spec = spec;
        this.registeredAt = registeredAt;
        this.future = future;
        this.onCancel = onCancel;
    }

    /**
     * Handle for a job with nothing left to fire, never registered with the local timer
     */
    static JobHandle expired(String name, JobSpec spec, Instant registeredAt) {
        return new JobHandle(name, spec, registeredAt, null, handle -> {
        });
    }

    /**
     * Stop future local firings of this job
     *
     * @return false if the job had already been cancelled or has no firings left
     */
    public boolean cancel() {
        if (future == null) {
            return false;
        }
        var cancelled = future.cancel(false);
        onCancel.accept(this);
        return cancelled;
    }

    public boolean isCancelled() {
        return future != null && future.isCancelled();
    }

    /**
     * Whether the local timer has no further firings of this job
     */
    public boolean isDone() {
        return future == null || future.isDone();
    }

    /**
     * Delay until the next local firing, empty if none is pending
     */
    public Optional<Long> getNextFiringDelayMs() {
        if (isDone()) {
            return Optional.empty();
        }
        return Optional.of(Math.max(0L, future.getDelay(TimeUnit.MILLISECONDS)));
    }
}
