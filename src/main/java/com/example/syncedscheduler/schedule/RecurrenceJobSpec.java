package com.example.syncedscheduler.schedule;

import com.example.syncedscheduler.domain.enums.JobKind;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.scheduling.TaskScheduler;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Recurrence rule schedule.
 * <p>
 * A firing stands for the rule's next occurrence after the moment it runs, truncated to
 * whole seconds. When the rule has no later occurrence the firing stands for the current
 * second. Whether the firing is recurring follows the rule.
 */
@Getter
@EqualsAndHashCode
public class RecurrenceJobSpec implements JobSpec {

    private final RecurrenceRule rule;

    public RecurrenceJobSpec(RecurrenceRule rule) {
        this.rule = Objects.requireNonNull(rule, "rule");
    }

    @Override
    public JobKind getKind() {
        return JobKind.RECURRENCE;
    }

    @Override
    public Firing nextFiring(ZonedDateTime now) {
        var next = rule.nextInvocationAfter(now)
                .orElse(now)
                .truncatedTo(ChronoUnit.SECONDS);
        return new Firing(next.toInstant().toEpochMilli(), rule.recurs());
    }

    @Override
    public ScheduledFuture<?> schedule(TaskScheduler taskScheduler, Runnable task, ZoneId zone) {
        return taskScheduler.schedule(task, new RecurrenceRuleTrigger(rule, zone));
    }

    @Override
    public String describe() {
        return rule.toString();
    }
}
