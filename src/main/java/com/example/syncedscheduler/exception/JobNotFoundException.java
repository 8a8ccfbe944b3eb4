package com.example.syncedscheduler.exception;

import lombok.Getter;

/**
 * Exception for a job that is not registered on this instance
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("Job not found: " + jobName);
        this.jobName = jobName;
    }
}
