package com.example.syncedscheduler.exception;

import lombok.Getter;

/**
 * Exception for watermark store read or write failures
 */
@Getter
public class WatermarkStoreException extends RuntimeException {

    private final String jobName;
    private final String operation;

    public WatermarkStoreException(String jobName, String operation, Exception cause) {
        super(String.format("Watermark %s failed for job %s: %s", operation, jobName, cause.getMessage()), cause);
        this.jobName = jobName;
        this.operation = operation;
    }
}
