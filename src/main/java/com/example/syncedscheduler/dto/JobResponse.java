package com.example.syncedscheduler.dto;

import com.example.syncedscheduler.domain.enums.JobKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for a job registered on this instance
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private String name;
    private JobKind kind;
    private String schedule;
    private Instant registeredAt;
    private boolean cancelled;
    private boolean done;
    private Long nextFiringDelayMs;

    /**
     * Shared watermark, null if no instance has claimed an occurrence yet
     */
    private WatermarkResponse watermark;
}
