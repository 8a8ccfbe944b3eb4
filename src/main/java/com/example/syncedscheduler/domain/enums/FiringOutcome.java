package com.example.syncedscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * What happened to one local firing of a job.
 */
@Getter
@RequiredArgsConstructor
public enum FiringOutcome {

    /**
     * This instance claimed the occurrence and the action completed.
     */
    EXECUTED("executed"),

    /**
     * Another instance had already claimed the occurrence.
     */
    SKIPPED("skipped"),

    /**
     * This instance claimed the occurrence but the action threw.
     * The occurrence is consumed and not retried.
     */
    FAILED("failed"),

    /**
     * The lock or the watermark store failed before a claim could be made.
     */
    ERROR("error");

    private final String code;

    /**
     * Whether the occurrence was claimed by this instance
     */
    public boolean isClaimed() {
        return this == EXECUTED || this == FAILED;
    }
}
