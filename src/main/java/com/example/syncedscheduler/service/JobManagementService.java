package com.example.syncedscheduler.service;

import com.example.syncedscheduler.domain.entity.JobWatermark;
import com.example.syncedscheduler.domain.enums.JobKind;
import com.example.syncedscheduler.domain.repository.JobWatermarkRepository;
import com.example.syncedscheduler.dto.JobResponse;
import com.example.syncedscheduler.dto.WatermarkResponse;
import com.example.syncedscheduler.exception.JobNotFoundException;
import com.example.syncedscheduler.mapper.JobMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read and cancel operations over the jobs registered on this instance,
 * joined with their shared watermarks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    private final SyncedScheduler syncedScheduler;
    private final JobWatermarkRepository watermarkRepository;
    private final JobMapper jobMapper;

    /**
     * List local jobs, optionally restricted to one schedule kind
     */
    @Transactional(readOnly = true)
    public List<JobResponse> getJobs(JobKind kind) {
        var handles = syncedScheduler.getJobs().stream()
                .filter(handle -> kind == null || handle.getSpec().getKind() == kind)
                .toList();

        var names = handles.stream().map(JobHandle::getName).toList();
        Map<String, JobWatermark> watermarks = names.isEmpty()
                ? Map.of()
                : watermarkRepository.findByJobNameIn(names).stream()
                        .collect(Collectors.toMap(JobWatermark::getJobName, Function.identity()));

        return handles.stream()
                .map(handle -> toResponse(handle, watermarks.get(handle.getName())))
                .toList();
    }

    @Transactional(readOnly = true)
    public JobResponse getJob(String jobName) {
        var handle = syncedScheduler.getJob(jobName).orElseThrow(() -> new JobNotFoundException(jobName));
        return toResponse(handle, watermarkRepository.findById(jobName).orElse(null));
    }

    /**
     * Cancel local firings. Other instances and the watermark are not affected.
     */
    public JobResponse cancelJob(String jobName) {
        log.info("Cancelling job {} on this instance", jobName);
        var handle = syncedScheduler.cancelJob(jobName);
        return toResponse(handle, watermarkRepository.findById(jobName).orElse(null));
    }

    /**
     * Get the shared watermark of a job, whether or not it is registered here
     */
    @Transactional(readOnly = true)
    public Optional<WatermarkResponse> getWatermark(String jobName) {
        return watermarkRepository.findById(jobName).map(jobMapper::toWatermarkResponse);
    }

    private JobResponse toResponse(JobHandle handle, JobWatermark watermark) {
        var response = jobMapper.toResponse(handle);
        if (watermark != null) {
            response.setWatermark(jobMapper.toWatermarkResponse(watermark));
        }
        return response;
    }
}
