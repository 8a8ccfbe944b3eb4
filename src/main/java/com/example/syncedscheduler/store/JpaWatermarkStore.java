package com.example.syncedscheduler.store;

import com.example.syncedscheduler.domain.entity.JobWatermark;
import com.example.syncedscheduler.domain.repository.JobWatermarkRepository;
import com.example.syncedscheduler.exception.WatermarkStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.net.InetAddress;
import java.time.Clock;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Watermark store backed by the {@code job_watermarks} table.
 * <p>
 * Database errors are translated to {@link WatermarkStoreException} so the caller
 * can release the job lock and abandon the firing.
 */
@Slf4j
@Component
public class JpaWatermarkStore implements WatermarkStore {

    private final JobWatermarkRepository watermarkRepository;
    private final Clock clock;
    private final String hostname;

    private String instanceId;

    public JpaWatermarkStore(JobWatermarkRepository watermarkRepository, Clock clock,
                             @Value("${HOSTNAME:unknown}") String hostname) {
        this.watermarkRepository = watermarkRepository;
        this.clock = clock;
        this.hostname = hostname;
    }

    @Override
    @Transactional(readOnly = true)
    public OptionalLong get(String jobName) {
        try {
            return watermarkRepository.findById(jobName)
                    .map(JobWatermark::getNextExecution)
                    .map(OptionalLong::of)
                    .orElse(OptionalLong.empty());
        } catch (DataAccessException e) {
            throw new WatermarkStoreException(jobName, "read", e);
        }
    }

    @Override
    @Transactional
    public void set(String jobName, long nextExecution) {
        try {
            watermarkRepository.upsertWatermark(jobName, nextExecution, getInstanceId(), clock.instant());
            log.debug("Watermark of job {} set to {}", jobName, nextExecution);
        } catch (DataAccessException e) {
            throw new WatermarkStoreException(jobName, "write", e);
        }
    }

    /**
     * Get unique instance ID for this service instance
     */
    String getInstanceId() {
        if (instanceId == null) {
            try {
                var host = InetAddress.getLocalHost().getHostName();
                instanceId = host + "-" + ProcessHandle.current().pid();
            } catch (Exception e) {
                instanceId = hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
            }
        }
        return instanceId;
    }
}
