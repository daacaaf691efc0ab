package com.example.scanscheduler.service.engine;

import com.example.scanscheduler.client.ScanTaskClient;
import com.example.scanscheduler.client.ScanTaskModels.ScanTaskRequest;
import com.example.scanscheduler.client.ScanTaskModels.ScanTaskResult;
import com.example.scanscheduler.config.ScanSchedulerProperties;
import com.example.scanscheduler.config.SchedulerMetrics;
import com.example.scanscheduler.domain.entity.JobExecution;
import com.example.scanscheduler.domain.entity.ScanSchedule;
import com.example.scanscheduler.exception.InvalidScheduleDefinitionException;
import com.example.scanscheduler.service.history.ExecutionHistoryService;
import com.example.scanscheduler.service.history.ExecutionOutcome;
import com.example.scanscheduler.service.lease.LeaseManager;
import com.example.scanscheduler.service.lease.LeaseOutcome;
import com.example.scanscheduler.service.lease.LeaseToken;
import com.example.scanscheduler.service.schedule.ScheduleStore;
import com.example.scanscheduler.service.timing.NextRunCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one due occurrence of a schedule.
 * <p>
 * Flow:
 * 1. Take the schedule lease, skip if another instance holds it
 * 2. Re-read the schedule, stop if it is gone, disabled or the occurrence was already started
 * 3. Record the execution start, giving up and retrying later if it cannot be stored
 * 4. Call the scan service, renewing the lease until it answers or the soft timeout passes
 * 5. Record the outcome, release the lease and store the next run time
 * <p>
 * Never throws. The returned occurrence is the one the engine should arm
 * next; empty means the schedule no longer exists.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanJobRunner {

    static final Duration STORE_RETRY_DELAY = Duration.ofSeconds(30);

    private final LeaseManager leaseManager;
    private final ScheduleStore scheduleStore;
    private final ExecutionHistoryService historyService;
    private final ScanTaskClient scanTaskClient;
    private final NextRunCalculator nextRunCalculator;
    private final ScanSchedulerProperties properties;
    private final SchedulerMetrics metrics;
    private final Clock clock;

    public Optional<ScheduledOccurrence> run(ScheduledOccurrence occurrence) {
        var scheduleId = occurrence.getScheduleId();
        var leaseKey = LeaseManager.scheduleKey(scheduleId);
        metrics.recordFired();

        Optional<LeaseToken> lease;
        try {
            lease = leaseManager.tryAcquire(leaseKey, properties.leaseTtl());
        } catch (RuntimeException e) {
            log.warn("Lease store unavailable for schedule {}, retrying in {}s: {}",
                    scheduleId, STORE_RETRY_DELAY.toSeconds(), e.getMessage());
            return Optional.of(occurrence.retryAt(clock.instant().plus(STORE_RETRY_DELAY)));
        }

        if (lease.isEmpty()) {
            return skipContended(occurrence);
        }

        var token = lease.get();
        ScanSchedule schedule;
        try {
            var found = scheduleStore.get(scheduleId);
            if (found.isEmpty()) {
                log.info("Schedule {} no longer exists, dropping occurrence at {}", scheduleId, occurrence.getFireAt());
                releaseQuietly(leaseKey, token);
                return Optional.empty();
            }
            schedule = found.get();
        } catch (RuntimeException e) {
            log.warn("Schedule store unavailable for schedule {}, retrying in {}s: {}",
                    scheduleId, STORE_RETRY_DELAY.toSeconds(), e.getMessage());
            releaseQuietly(leaseKey, token);
            return Optional.of(occurrence.retryAt(clock.instant().plus(STORE_RETRY_DELAY)));
        }

        if (!schedule.isEnabled()) {
            log.info("Schedule {} is disabled, skipping occurrence at {}", scheduleId, occurrence.getFireAt());
            metrics.recordSkipped("disabled");
            releaseQuietly(leaseKey, token);
            return followingOccurrence(schedule, occurrence.getFireAt());
        }

        if (schedule.hasStartedOccurrence(occurrence.getFireAt())) {
            log.info("Occurrence at {} of schedule {} was already started at {}, skipping",
                    occurrence.getFireAt(), scheduleId, schedule.getLastRunStartedAt());
            metrics.recordSkipped("already_started");
            releaseQuietly(leaseKey, token);
            return followingOccurrence(schedule, occurrence.getFireAt());
        }

        return execute(schedule, occurrence, leaseKey, token);
    }

    private Optional<ScheduledOccurrence> skipContended(ScheduledOccurrence occurrence) {
        var schedule = occurrence.getSchedule();
        log.info("Skipping occurrence at {} of schedule {} ({}): running on another instance",
                occurrence.getFireAt(), occurrence.getScheduleId(), schedule.getDomain());
        metrics.recordSkipped("lease_contention");

        if (properties.isRecordContentionSkips()) {
            try {
                historyService.recordContentionSkip(schedule, occurrence.getFireAt());
            } catch (RuntimeException e) {
                log.warn("Could not record contention skip for schedule {}: {}", occurrence.getScheduleId(), e.getMessage());
            }
        }
        return nextAfter(schedule, notBeforeNow(occurrence.getFireAt()));
    }

    private Optional<ScheduledOccurrence> execute(ScanSchedule schedule, ScheduledOccurrence occurrence,
                                                  String leaseKey, LeaseToken token) {
        var scheduleId = schedule.getId();

        JobExecution execution;
        try {
            execution = historyService.startExecution(schedule, occurrence.getFireAt(), buildMetadata(schedule, occurrence, token));
        } catch (RuntimeException e) {
            log.warn("Could not record start of schedule {}, retrying in {}s: {}",
                    scheduleId, STORE_RETRY_DELAY.toSeconds(), e.getMessage());
            releaseQuietly(leaseKey, token);
            return Optional.of(occurrence.retryAt(clock.instant().plus(STORE_RETRY_DELAY)));
        }

        try {
            scheduleStore.markRunStart(scheduleId, execution.getStartedAt());
        } catch (RuntimeException e) {
            // Without the mark another instance could run this occurrence again
            log.warn("Could not mark run start of schedule {}, abandoning attempt and retrying in {}s: {}",
                    scheduleId, STORE_RETRY_DELAY.toSeconds(), e.getMessage());
            abandon(execution);
            releaseQuietly(leaseKey, token);
            return Optional.of(occurrence.retryAt(clock.instant().plus(STORE_RETRY_DELAY)));
        }

        log.info("Running scan for schedule {} ({}, occurrence at {})", scheduleId, schedule.getDomain(), occurrence.getFireAt());
        var timerSample = metrics.startExecutionTimer();
        var attempt = awaitTask(schedule, execution, leaseKey, token);
        var outcome = attempt.outcome;
        outcome.setCompletedAt(clock.instant());

        try {
            historyService.completeExecution(execution.getId(), outcome);
        } catch (RuntimeException e) {
            log.error("Could not record outcome {} of execution {}: {}", outcome.getStatus(), execution.getId(), e.getMessage());
        }
        metrics.recordExecution(timerSample, outcome.getStatus(), outcome.getErrorType());

        if (!attempt.leaseLost) {
            releaseQuietly(leaseKey, token);
        }

        try {
            var updated = scheduleStore.markRunResult(scheduleId, outcome.getCompletedAt(), outcome.getStatus());
            if (updated.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(updated.get().getNextRun())
                    .map(nextRun -> ScheduledOccurrence.of(updated.get(), nextRun));
        } catch (RuntimeException e) {
            log.warn("Could not store result of schedule {}, computing next run locally: {}", scheduleId, e.getMessage());
            return nextAfter(schedule, outcome.getCompletedAt());
        }
    }

    /**
     * Wait for the scan task, renewing the lease every renew interval
     */
    private TaskAttempt awaitTask(ScanSchedule schedule, JobExecution execution, String leaseKey, LeaseToken token) {
        var request = ScanTaskRequest.builder()
                .scheduleId(schedule.getId())
                .executionId(execution.getId())
                .domain(schedule.getDomain())
                .domainConfigId(schedule.getDomainConfigId())
                .profileId(schedule.getProfileId())
                .scanType(schedule.getScanType())
                .scanParams(schedule.getScanParams())
                .build();

        CompletableFuture<ScanTaskResult> future;
        try {
            future = scanTaskClient.submit(request);
        } catch (RuntimeException e) {
            log.error("Scan submission for schedule {} failed: {}", schedule.getId(), e.getMessage());
            return new TaskAttempt(ExecutionOutcome.failure(e), false);
        }

        var softTimeout = properties.taskSoftTimeout();
        var renewEveryNanos = properties.leaseRenewInterval().toNanos();
        var deadline = System.nanoTime() + softTimeout.toNanos();

        while (true) {
            var remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                future.cancel(true);
                log.warn("Scan for schedule {} exceeded soft timeout of {}s", schedule.getId(), softTimeout.toSeconds());
                return new TaskAttempt(ExecutionOutcome.failure(ExecutionOutcome.ERROR_TIMEOUT,
                        "Scan task did not finish within " + softTimeout.toSeconds() + "s"), false);
            }
            try {
                var result = future.get(Math.min(remaining, renewEveryNanos), TimeUnit.NANOSECONDS);
                return new TaskAttempt(toOutcome(result), false);
            } catch (TimeoutException e) {
                if (deadline - System.nanoTime() <= 0) {
                    continue;
                }
                var renewal = renew(leaseKey, token);
                if (renewal == LeaseOutcome.LOST) {
                    future.cancel(true);
                    log.error("Lease for schedule {} was lost while its scan was running", schedule.getId());
                    return new TaskAttempt(ExecutionOutcome.failure(ExecutionOutcome.ERROR_LEASE_LOST,
                            "Lease lost while the scan task was running"), true);
                }
            } catch (ExecutionException e) {
                var cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Scan for schedule {} failed: {}", schedule.getId(), cause.getMessage());
                return new TaskAttempt(ExecutionOutcome.failure(cause), false);
            } catch (CancellationException e) {
                return new TaskAttempt(ExecutionOutcome.failure("CANCELLED", "Scan task was cancelled"), false);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                log.warn("Interrupted while waiting for scan of schedule {}", schedule.getId());
                return new TaskAttempt(ExecutionOutcome.failure("INTERRUPTED",
                        "Scheduler stopped before the scan task finished"), false);
            }
        }
    }

    private LeaseOutcome renew(String leaseKey, LeaseToken token) {
        try {
            return leaseManager.renew(leaseKey, token, properties.leaseTtl());
        } catch (RuntimeException e) {
            // Still valid until its expiry; try again next interval
            log.warn("Could not renew lease {}: {}", leaseKey, e.getMessage());
            return LeaseOutcome.OK;
        }
    }

    private ExecutionOutcome toOutcome(ScanTaskResult result) {
        if (result == null) {
            return ExecutionOutcome.failure(ExecutionOutcome.ERROR_TASK_FAILED, "Scan task returned no result");
        }
        if (result.isSuccess()) {
            return ExecutionOutcome.success(result.getScanId());
        }
        var message = result.getError() != null ? result.getError() : "Scan finished with status " + result.getStatus();
        return ExecutionOutcome.taskFailure(result.getScanId(), message, result.getDetails());
    }

    private void abandon(JobExecution execution) {
        var outcome = ExecutionOutcome.cancelled("Run start could not be stored, occurrence will be retried");
        outcome.setCompletedAt(clock.instant());
        try {
            historyService.completeExecution(execution.getId(), outcome);
        } catch (RuntimeException e) {
            log.warn("Could not cancel execution {}, the orphan reaper will close it: {}", execution.getId(), e.getMessage());
        }
    }

    private void releaseQuietly(String leaseKey, LeaseToken token) {
        try {
            if (leaseManager.release(leaseKey, token) == LeaseOutcome.LOST) {
                log.info("Lease {} had already been taken over at release", leaseKey);
            }
        } catch (RuntimeException e) {
            log.warn("Could not release lease {}, it will expire at {}: {}", leaseKey, token.getExpiresAt(), e.getMessage());
        }
    }

    /**
     * Next occurrence after a skipped one: the stored next run when it is
     * still ahead, otherwise computed from the definition. Never in the past,
     * so a skipped catch-up does not fire again straight away.
     */
    private Optional<ScheduledOccurrence> followingOccurrence(ScanSchedule schedule, Instant fireAt) {
        var reference = notBeforeNow(fireAt);
        var stored = schedule.getNextRun();
        if (stored != null && stored.isAfter(reference)) {
            return Optional.of(ScheduledOccurrence.of(schedule, stored));
        }
        return nextAfter(schedule, reference);
    }

    private Instant notBeforeNow(Instant instant) {
        var now = clock.instant();
        return instant.isAfter(now) ? instant : now;
    }

    private Optional<ScheduledOccurrence> nextAfter(ScanSchedule schedule, Instant after) {
        try {
            return Optional.of(ScheduledOccurrence.of(schedule, nextRunCalculator.nextRun(schedule, after)));
        } catch (InvalidScheduleDefinitionException e) {
            log.error("Schedule {} has an invalid definition, not re-arming: {}", schedule.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private HashMap<String, Object> buildMetadata(ScanSchedule schedule, ScheduledOccurrence occurrence, LeaseToken token) {
        var metadata = new HashMap<String, Object>();
        var lateBy = Duration.between(occurrence.getFireAt(), clock.instant());
        metadata.put("trigger", lateBy.compareTo(Duration.ofMinutes(1)) > 0 ? "catch_up" : "scheduled");
        metadata.put("scan_type", schedule.getScanType().getCode());
        metadata.put("lease_expires_at", token.getExpiresAt().toString());
        return metadata;
    }

    private static final class TaskAttempt {

        private final ExecutionOutcome outcome;
        private final boolean leaseLost;

        private TaskAttempt(ExecutionOutcome outcome, boolean leaseLost) {
            this.outcome = outcome;
            this.leaseLost = leaseLost;
        }
    }
}
