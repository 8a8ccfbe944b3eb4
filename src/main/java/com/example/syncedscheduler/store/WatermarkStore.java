package com.example.syncedscheduler.store;

import java.util.OptionalLong;

/**
 * Key-value store holding the execution watermark of each job.
 * <p>
 * Implementations must be shared by every instance running the same jobs.
 * A watermark kept in process memory would not deduplicate anything.
 */
public interface WatermarkStore {

    /**
     * Read the watermark of a job
     *
     * @param jobName The job name, used as key
     * @return Epoch milliseconds of the last claimed occurrence, or empty if none was ever claimed
     */
    OptionalLong get(String jobName);

    /**
     * Overwrite the watermark of a job
     *
     * @param jobName       The job name, used as key
     * @param nextExecution Epoch milliseconds of the claimed occurrence
     */
    void set(String jobName, long nextExecution);
}
