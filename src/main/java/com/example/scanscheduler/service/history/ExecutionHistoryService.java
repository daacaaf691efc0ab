package com.example.scanscheduler.service.history;

import com.example.scanscheduler.config.InstanceIdentity;
import com.example.scanscheduler.domain.entity.JobExecution;
import com.example.scanscheduler.domain.entity.ScanSchedule;
import com.example.scanscheduler.domain.enums.ExecutionStatus;
import com.example.scanscheduler.domain.repository.ExecutionAggregate;
import com.example.scanscheduler.domain.repository.JobExecutionRepository;
import com.example.scanscheduler.dto.ExecutionStatistics;
import com.example.scanscheduler.dto.JobExecutionResponse;
import com.example.scanscheduler.mapper.ExecutionMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of every execution attempt.
 * <p>
 * Provides:
 * - Execution start and exactly-once completion
 * - Optional records for occurrences skipped on lease contention
 * - Recent, per-schedule and per-domain queries
 * - Aggregate statistics over a trailing window
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionHistoryService {

    public static final String REASON_LEASE_CONTENTION = "lease_contention";

    private final JobExecutionRepository executionRepository;
    private final ExecutionMapper executionMapper;
    private final InstanceIdentity instanceIdentity;
    private final Clock clock;

    // === Recording ===

    /**
     * Record the start of an execution for the occurrence due at {@code occurrenceAt}
     */
    @Transactional
    public JobExecution startExecution(ScanSchedule schedule, Instant occurrenceAt, Map<String, Object> metadata) {
        var execution = JobExecution.builder()
                .scheduleId(schedule.getId())
                .jobId(schedule.getJobId())
                .domain(schedule.getDomain())
                .domainConfigId(schedule.getDomainConfigId())
                .status(ExecutionStatus.STARTED)
                .occurrenceAt(occurrenceAt)
                .executorInstance(instanceIdentity.getId())
                .startedAt(clock.instant())
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .build();

        execution = executionRepository.save(execution);
        log.info("Execution {} started for schedule {} ({})", execution.getId(), schedule.getId(), schedule.getDomain());

        return execution;
    }

    /**
     * Move a STARTED execution to its terminal status.
     *
     * @return false if the execution does not exist or was already completed
     */
    @Transactional
    public boolean completeExecution(UUID executionId, ExecutionOutcome outcome) {
        var found = executionRepository.findByIdForUpdate(executionId);
        if (found.isEmpty()) {
            log.warn("Cannot complete execution {}: not found", executionId);
            return false;
        }
        var execution = found.get();

        if (!execution.getStatus().canTransitionTo(outcome.getStatus())) {
            log.warn("Execution {} is already {}, ignoring {}", executionId, execution.getStatus(), outcome.getStatus());
            return false;
        }

        var completedAt = outcome.getCompletedAt() != null ? outcome.getCompletedAt() : clock.instant();
        if (completedAt.isBefore(execution.getStartedAt())) {
            completedAt = execution.getStartedAt();
        }

        execution.setStatus(outcome.getStatus());
        execution.setCompletedAt(completedAt);
        execution.calculateDuration();
        execution.setScanId(outcome.getScanId());
        execution.setErrorMessage(outcome.getErrorMessage());
        execution.setErrorType(outcome.getErrorType());
        execution.setErrorDetails(buildErrorDetails(outcome));

        executionRepository.save(execution);

        if (outcome.isSuccess()) {
            log.info("Execution {} succeeded in {}ms (scan {})", executionId, execution.getDurationMs(), outcome.getScanId());
        } else {
            log.warn("Execution {} ended {} ({}): {}", executionId, outcome.getStatus(), outcome.getErrorType(), outcome.getErrorMessage());
        }
        return true;
    }

    /**
     * Record an occurrence skipped because another instance held the lease
     */
    @Transactional
    public JobExecution recordContentionSkip(ScanSchedule schedule, Instant occurrenceAt) {
        var now = clock.instant();
        var metadata = new HashMap<String, Object>();
        metadata.put("reason", REASON_LEASE_CONTENTION);

        var execution = JobExecution.builder()
                .scheduleId(schedule.getId())
                .jobId(schedule.getJobId())
                .domain(schedule.getDomain())
                .domainConfigId(schedule.getDomainConfigId())
                .status(ExecutionStatus.CANCELLED)
                .occurrenceAt(occurrenceAt)
                .executorInstance(instanceIdentity.getId())
                .startedAt(now)
                .completedAt(now)
                .durationMs(0L)
                .errorMessage("Lease held by another instance")
                .metadata(metadata)
                .build();

        return executionRepository.save(execution);
    }

    private Map<String, Object> buildErrorDetails(ExecutionOutcome outcome) {
        if (outcome.isSuccess()) {
            return null;
        }
        var details = new HashMap<String, Object>();
        if (outcome.getDetails() != null) {
            details.putAll(outcome.getDetails());
        }
        if (outcome.getStackTrace() != null) {
            details.put("stackTrace", outcome.getStackTrace());
        }
        return details.isEmpty() ? null : details;
    }

    // === Queries ===

    @Transactional(readOnly = true)
    public Optional<JobExecutionResponse> getExecution(UUID executionId) {
        return executionRepository.findById(executionId).map(executionMapper::toResponse);
    }

    /**
     * Executions started within the last {@code hours}, newest first
     */
    @Transactional(readOnly = true)
    public List<JobExecutionResponse> listRecent(int hours) {
        var since = clock.instant().minus(Duration.ofHours(hours));
        return executionMapper.toResponses(executionRepository.findByStartedAtGreaterThanEqualOrderByStartedAtDesc(since));
    }

    @Transactional(readOnly = true)
    public List<JobExecutionResponse> listRecent(int hours, ExecutionStatus status) {
        if (status == null) {
            return listRecent(hours);
        }
        var since = clock.instant().minus(Duration.ofHours(hours));
        return executionMapper.toResponses(
                executionRepository.findByStartedAtGreaterThanEqualAndStatusOrderByStartedAtDesc(since, status));
    }

    @Transactional(readOnly = true)
    public List<JobExecutionResponse> listBySchedule(UUID scheduleId, int limit) {
        return executionMapper.toResponses(
                executionRepository.findByScheduleIdOrderByStartedAtDesc(scheduleId, PageRequest.of(0, limit)));
    }

    @Transactional(readOnly = true)
    public List<JobExecutionResponse> listByDomain(String domain, int limit) {
        return executionMapper.toResponses(
                executionRepository.findByDomainOrderByStartedAtDesc(domain, PageRequest.of(0, limit)));
    }

    // === Statistics ===

    @Transactional(readOnly = true)
    public ExecutionStatistics statistics(int days) {
        return statistics(days, null, null);
    }

    /**
     * Aggregate statistics over the last {@code days}, optionally narrowed
     * to one schedule or one domain (schedule wins when both are given)
     */
    @Transactional(readOnly = true)
    public ExecutionStatistics statistics(int days, UUID scheduleId, String domain) {
        var since = clock.instant().minus(Duration.ofDays(days));

        ExecutionAggregate aggregate;
        if (scheduleId != null) {
            aggregate = executionRepository.aggregateForSchedule(since, scheduleId);
        } else if (domain != null) {
            aggregate = executionRepository.aggregateForDomain(since, domain);
        } else {
            aggregate = executionRepository.aggregateSince(since);
        }

        var total = toLong(aggregate.getTotal());
        var successful = toLong(aggregate.getSuccessful());

        return ExecutionStatistics.builder()
                .total(total)
                .successful(successful)
                .failed(toLong(aggregate.getFailed()))
                .cancelled(toLong(aggregate.getCancelled()))
                .successRate(total == 0 ? 0.0 : (double) successful / total * 100)
                .avgDurationMs(aggregate.getAvgDurationMs() != null ? aggregate.getAvgDurationMs().doubleValue() : null)
                .minDurationMs(aggregate.getMinDurationMs() != null ? aggregate.getMinDurationMs().longValue() : null)
                .maxDurationMs(aggregate.getMaxDurationMs() != null ? aggregate.getMaxDurationMs().longValue() : null)
                .periodDays(days)
                .generatedAt(clock.instant())
                .build();
    }

    private static long toLong(Number value) {
        return value != null ? value.longValue() : 0L;
    }
}
