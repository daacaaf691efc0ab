package com.example.scanscheduler.dto;

import com.example.scanscheduler.domain.enums.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for a job execution
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobExecutionResponse {

    private UUID id;
    private UUID scheduleId;
    private String jobId;
    private String domain;
    private UUID domainConfigId;
    private ExecutionStatus status;
    private Instant occurrenceAt;
    private String executorInstance;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private String scanId;
    private String errorMessage;
    private String errorType;
    private Map<String, Object> errorDetails;
    private Map<String, Object> metadata;
}
