package com.example.syncedscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for the shared watermark of a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WatermarkResponse {

    private String jobName;

    /**
     * Epoch milliseconds of the last claimed occurrence
     */
    private Long nextExecution;
    private Instant nextExecutionAt;
    private String updatedBy;
    private Instant updatedAt;
}
