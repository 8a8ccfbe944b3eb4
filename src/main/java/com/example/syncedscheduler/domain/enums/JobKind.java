package com.example.syncedscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Shape of a job schedule, resolved once at registration.
 */
@Getter
@RequiredArgsConstructor
public enum JobKind {

    /**
     * Cron expression, fires repeatedly.
     */
    CRON("cron"),

    /**
     * Recurrence rule. Recurs unless the rule itself says otherwise.
     */
    RECURRENCE("recurrence"),

    /**
     * Absolute date, fires once.
     */
    ONE_OFF("one-off");

    private final String code;

    public static JobKind fromCode(String code) {
        for (var kind : values()) {
            if (kind.getCode().equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown job kind code: " + code);
    }
}
