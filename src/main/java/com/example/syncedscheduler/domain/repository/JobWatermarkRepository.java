package com.example.syncedscheduler.domain.repository;

import com.example.syncedscheduler.domain.entity.JobWatermark;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for JobWatermark entity.
 * <p>
 * Writes are only issued from inside the job lock, so a plain upsert is enough
 * and no optimistic locking is involved.
 */
@Repository
public interface JobWatermarkRepository extends JpaRepository<JobWatermark, String> {

    /**
     * Insert or overwrite the watermark of a job in one statement.
     *
     * @return number of rows written
     */
    @Modifying
    @Query(value = """
            INSERT INTO job_watermarks (job_name, next_execution, updated_by, updated_at)
            VALUES (:jobName, :nextExecution, :updatedBy, :now)
            ON CONFLICT (job_name) DO UPDATE
              SET next_execution = EXCLUDED.next_execution,
                  updated_by = EXCLUDED.updated_by,
                  updated_at = EXCLUDED.updated_at
            """, nativeQuery = true)
    int upsertWatermark(
            @Param("jobName") String jobName,
            @Param("nextExecution") long nextExecution,
            @Param("updatedBy") String updatedBy,
            @Param("now") Instant now
    );

    List<JobWatermark> findByJobNameIn(Collection<String> jobNames);
}
