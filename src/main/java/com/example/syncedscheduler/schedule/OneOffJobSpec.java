package com.example.syncedscheduler.schedule;

import com.example.syncedscheduler.domain.enums.JobKind;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Fixed date schedule. Every firing stands for the same occurrence.
 */
@Getter
@EqualsAndHashCode
public class OneOffJobSpec implements JobSpec {

    private final Instant date;

    public OneOffJobSpec(Instant date) {
        this.date = Objects.requireNonNull(date, "date");
    }

    @Override
    public JobKind getKind() {
        return JobKind.ONE_OFF;
    }

    @Override
    public Firing nextFiring(ZonedDateTime now) {
        return Firing.once(date);
    }

    @Override
    public ScheduledFuture<?> schedule(TaskScheduler taskScheduler, Runnable task, ZoneId zone) {
        return taskScheduler.schedule(task, date);
    }

    @Override
    public String describe() {
        return date.toString();
    }
}
