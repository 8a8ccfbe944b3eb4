package com.example.syncedscheduler.exception;

import lombok.Getter;

/**
 * Exception for a job lock that could not be acquired
 */
@Getter
public class LockAcquisitionException extends RuntimeException {

    private final String lockName;

    public LockAcquisitionException(String lockName, String reason) {
        super(String.format("Failed to acquire lock %s: %s", lockName, reason));
        this.lockName = lockName;
    }

    public LockAcquisitionException(String lockName, String reason, Exception cause) {
        super(String.format("Failed to acquire lock %s: %s", lockName, reason), cause);
        this.lockName = lockName;
    }
}
