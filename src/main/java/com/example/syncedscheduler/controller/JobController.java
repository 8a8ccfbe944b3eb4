package com.example.syncedscheduler.controller;

import com.example.syncedscheduler.domain.enums.JobKind;
import com.example.syncedscheduler.dto.ApiResponse;
import com.example.syncedscheduler.dto.JobResponse;
import com.example.syncedscheduler.dto.WatermarkResponse;
import com.example.syncedscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for inspecting and cancelling synced jobs.
 * <p>
 * Job endpoints describe registrations on the instance serving the request.
 * Watermark endpoints read the state shared by all instances.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
@Tag(name = "Synced Jobs", description = "APIs for inspecting jobs and their shared watermarks")
public class JobController {

    private final JobManagementService jobManagementService;

    @GetMapping("/jobs")
    @Operation(summary = "List jobs", description = "List jobs registered on this instance")
    public ResponseEntity<ApiResponse<List<JobResponse>>> getJobs(
            @Parameter(description = "Schedule kind filter (cron, recurrence, one-off)")
            @RequestParam(required = false) String kind) {

        var jobKind = kind != null ? JobKind.fromCode(kind) : null;
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJobs(jobKind)));
    }

    @GetMapping("/jobs/{jobName}")
    @Operation(summary = "Get job", description = "Get a job registered on this instance with its shared watermark")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(
            @Parameter(description = "Job name") @PathVariable String jobName) {

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJob(jobName)));
    }

    @PostMapping("/jobs/{jobName}/cancel")
    @Operation(summary = "Cancel job", description = "Stop local firings of a job. Other instances keep firing")
    public ResponseEntity<ApiResponse<JobResponse>> cancelJob(
            @Parameter(description = "Job name") @PathVariable String jobName) {
        log.info("API: Cancel job {}", jobName);

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.cancelJob(jobName), "Job cancelled on this instance"));
    }

    @GetMapping("/watermarks/{jobName}")
    @Operation(summary = "Get watermark", description = "Get the last occurrence claimed for a job by any instance")
    public ResponseEntity<ApiResponse<WatermarkResponse>> getWatermark(
            @Parameter(description = "Job name") @PathVariable String jobName) {

        return jobManagementService.getWatermark(jobName)
                .map(watermark -> ResponseEntity.ok(ApiResponse.success(watermark)))
                .orElse(ResponseEntity.notFound().build());
    }
}
