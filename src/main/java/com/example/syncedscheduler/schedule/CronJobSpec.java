package com.example.syncedscheduler.schedule;

import com.example.syncedscheduler.domain.enums.JobKind;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;

/**
 * Cron schedule.
 * <p>
 * Accepts five-field Unix expressions ({@code "0 * * * *"}) as well as Spring's
 * six-field form with seconds and macros such as {@code @hourly}.
 * A firing stands for the next fire time strictly after the moment it runs.
 */
@Getter
@EqualsAndHashCode(of = "expression")
public class CronJobSpec implements JobSpec {

    private final String expression;
    private final String normalizedExpression;

    /**
     * @throws IllegalArgumentException if the expression cannot be parsed
     */
    public CronJobSpec(String expression) {
        this.expression = expression;
        this.normalizedExpression = normalize(expression);
        CronExpression.parse(normalizedExpression);
    }

    static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be blank");
        }
        var trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            return trimmed;
        }
        var fields = trimmed.split("\\s+");
        return fields.length == 5 ? "0 " + String.join(" ", fields) : String.join(" ", fields);
    }

    @Override
    public JobKind getKind() {
        return JobKind.CRON;
    }

    @Override
    public Firing nextFiring(ZonedDateTime now) {
        var next = CronExpression.parse(normalizedExpression).next(now);
        if (next == null) {
            throw new IllegalStateException("Cron expression " + expression + " has no occurrence after " + now);
        }
        return Firing.recurring(next.toInstant());
    }

    @Override
    public ScheduledFuture<?> schedule(TaskScheduler taskScheduler, Runnable task, ZoneId zone) {
        return taskScheduler.schedule(task, new CronTrigger(normalizedExpression, zone));
    }

    @Override
    public String describe() {
        return expression;
    }
}
