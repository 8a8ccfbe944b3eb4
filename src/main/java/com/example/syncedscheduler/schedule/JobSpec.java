package com.example.syncedscheduler.schedule;

import com.example.syncedscheduler.domain.enums.JobKind;
import org.springframework.scheduling.TaskScheduler;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;

/**
 * A job schedule in one of the supported shapes.
 * <p>
 * Implementations adapt their shape to two questions:
 * - when should the local timer fire
 * - which occurrence does a given firing stand for
 */
public interface JobSpec {

    JobKind getKind();

    /**
     * Compute the occurrence a firing happening at {@code now} corresponds to.
     * Called on every firing, never cached.
     */
    Firing nextFiring(ZonedDateTime now);

    /**
     * Register a task with the local timer according to this schedule
     *
     * @return Handle of the local registration
     */
    ScheduledFuture<?> schedule(TaskScheduler taskScheduler, Runnable task, ZoneId zone);

    /**
     * Human-readable form of the schedule
     */
    String describe();
}
