package com.example.syncedscheduler.schedule;

import com.example.syncedscheduler.exception.InvalidJobSpecException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Resolves the schedule object passed at registration into a {@link JobSpec}.
 */
public final class JobSpecs {

    private JobSpecs() {
    }

    /**
     * Inspect the shape of {@code spec} once:
     * a {@link String} is a cron expression, a {@link RecurrenceRule} a recurrence,
     * and a date-like value a one-off date.
     *
     * @throws InvalidJobSpecException if the shape is unsupported or the value cannot be parsed
     */
    public static JobSpec from(String jobName, Object spec) {
        if (spec == null) {
            throw new InvalidJobSpecException(jobName, "schedule is required");
        }
        if (spec instanceof JobSpec jobSpec) {
            return jobSpec;
        }
        if (spec instanceof String expression) {
            try {
                return new CronJobSpec(expression);
            } catch (IllegalArgumentException e) {
                throw new InvalidJobSpecException(jobName, e.getMessage(), e);
            }
        }
        if (spec instanceof RecurrenceRule rule) {
            return new RecurrenceJobSpec(rule);
        }
        if (spec instanceof Instant instant) {
            return new OneOffJobSpec(instant);
        }
        if (spec instanceof Date date) {
            return new OneOffJobSpec(date.toInstant());
        }
        if (spec instanceof ZonedDateTime dateTime) {
            return new OneOffJobSpec(dateTime.toInstant());
        }
        if (spec instanceof OffsetDateTime dateTime) {
            return new OneOffJobSpec(dateTime.toInstant());
        }
        throw new InvalidJobSpecException(jobName, "unsupported schedule type " + spec.getClass().getName());
    }
}
