package com.example.bulkscheduler.mapper;

import com.example.bulkscheduler.domain.entity.JobRunLog;
import com.example.bulkscheduler.domain.entity.ScheduledJob;
import com.example.bulkscheduler.dto.JobRunLogResponse;
import com.example.bulkscheduler.dto.ScheduledJobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs.
 * Registry state (armed, executing) is filled in by the service.
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ScheduledJobMapper {

    ScheduledJobResponse toResponse(ScheduledJob job);

    List<ScheduledJobResponse> toResponseList(List<ScheduledJob> jobs);

    JobRunLogResponse toRunResponse(JobRunLog runLog);

    List<JobRunLogResponse> toRunResponses(List<JobRunLog> runLogs);
}
