package com.example.syncedscheduler.exception;

import lombok.Getter;

/**
 * Exception for a schedule that cannot be registered
 */
@Getter
public class InvalidJobSpecException extends RuntimeException {

    private final String jobName;

    public InvalidJobSpecException(String jobName, String reason) {
        super(String.format("Invalid schedule for job %s: %s", jobName, reason));
        this.jobName = jobName;
    }

    public InvalidJobSpecException(String jobName, String reason, Exception cause) {
        super(String.format("Invalid schedule for job %s: %s", jobName, reason), cause);
        this.jobName = jobName;
    }
}
