package com.example.syncedscheduler.schedule;

import lombok.Value;

import java.time.Instant;

/**
 * The occurrence a single local timer invocation corresponds to.
 */
@Value
public class Firing {

    /**
     * Epoch milliseconds of the occurrence, used as the watermark value
     */
    long nextExecution;

    /**
     * Whether the job produces further occurrences after this one
     */
    boolean recurring;

    public static Firing recurring(Instant nextExecution) {
        return new Firing(nextExecution.toEpochMilli(), true);
    }

    public static Firing once(Instant nextExecution) {
        return new Firing(nextExecution.toEpochMilli(), false);
    }
}
