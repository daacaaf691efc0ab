package com.example.scanscheduler.mapper;

import com.example.scanscheduler.domain.entity.JobExecution;
import com.example.scanscheduler.dto.JobExecutionResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting execution entities to DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ExecutionMapper {

    JobExecutionResponse toResponse(JobExecution execution);

    List<JobExecutionResponse> toResponses(List<JobExecution> executions);
}
