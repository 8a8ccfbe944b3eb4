package com.example.syncedscheduler.mapper;

import com.example.syncedscheduler.domain.entity.JobWatermark;
import com.example.syncedscheduler.dto.JobResponse;
import com.example.syncedscheduler.dto.WatermarkResponse;
import com.example.syncedscheduler.service.JobHandle;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

/**
 * MapStruct mapper for converting jobs and watermarks to DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    @Mapping(target = "nextExecutionAt", expression = "java(java.time.Instant.ofEpochMilli(watermark.getNextExecution()))")
    WatermarkResponse toWatermarkResponse(JobWatermark watermark);

    @Mapping(target = "kind", expression = "java(handle.getSpec().getKind())")
    @Mapping(target = "schedule", expression = "java(handle.getSpec().describe())")
    @Mapping(target = "cancelled", expression = "java(handle.isCancelled())")
    @Mapping(target = "done", expression = "java(handle.isDone())")
    @Mapping(target = "nextFiringDelayMs", expression = "java(handle.getNextFiringDelayMs().orElse(null))")
    @Mapping(target = "watermark", ignore = true)
    JobResponse toResponse(JobHandle handle);
}
