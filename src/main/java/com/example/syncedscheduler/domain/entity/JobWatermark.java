package com.example.syncedscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Shared execution watermark of a job family.
 * <p>
 * One row per job name, visible to every instance. Holds the epoch-millisecond
 * timestamp of the most recent occurrence an instance committed to run.
 * Rows are only written while the job lock is held and never expire.
 */
@Entity
@Table(name = "job_watermarks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobWatermark {

    @Id
    @Column(name = "job_name", updatable = false, nullable = false, length = 200)
    private String jobName;

    /**
     * Epoch milliseconds of the last claimed occurrence
     */
    @Column(name = "next_execution", nullable = false)
    private Long nextExecution;

    /**
     * Instance that claimed the occurrence
     */
    @Column(name = "updated_by", length = 100)
    private String updatedBy;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
