package com.example.scanscheduler.service.history;

import com.example.scanscheduler.config.ScanSchedulerProperties;
import com.example.scanscheduler.domain.entity.JobExecution;
import com.example.scanscheduler.domain.enums.ExecutionStatus;
import com.example.scanscheduler.domain.repository.JobExecutionRepository;
import com.example.scanscheduler.domain.repository.ScheduleLeaseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Cluster-wide housekeeping of execution history.
 * <p>
 * ShedLock ensures each job runs on only one instance at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionMaintenanceService {

    private final JobExecutionRepository executionRepository;
    private final ScheduleLeaseRepository leaseRepository;
    private final ExecutionHistoryService historyService;
    private final ScanSchedulerProperties properties;
    private final Clock clock;

    /**
     * Delete finished execution records past the retention period, together
     * with leases that expired before it
     */
    @Scheduled(fixedDelayString = "${scan-scheduler.maintenance-interval-ms:3600000}")
    @SchedulerLock(name = "executionHistoryCleanup", lockAtLeastFor = "1m", lockAtMostFor = "30m")
    public void cleanupOldExecutions() {
        try {
            var cutoff = clock.instant().minus(Duration.ofDays(properties.getHistoryRetentionDays()));
            var deleted = executionRepository.deleteOlderThan(cutoff);
            var leases = leaseRepository.deleteExpiredBefore(cutoff);
            if (deleted > 0 || leases > 0) {
                log.info("Deleted {} execution records and {} expired leases older than {}", deleted, leases, cutoff);
            } else {
                log.debug("No execution records older than {}", cutoff);
            }
        } catch (Exception e) {
            log.error("Error cleaning up execution history: {}", e.getMessage(), e);
        }
    }

    /**
     * Fail executions left STARTED by an instance that died mid-run.
     * <p>
     * The threshold is longer than any lease can be held, so a live
     * execution is never reaped.
     */
    @Scheduled(fixedDelayString = "${scan-scheduler.maintenance-interval-ms:3600000}", initialDelay = 60000)
    @SchedulerLock(name = "orphanedExecutionReaper", lockAtLeastFor = "30s", lockAtMostFor = "10m")
    public void reapOrphanedExecutions() {
        try {
            var threshold = clock.instant().minus(Duration.ofMinutes(properties.getOrphanedExecutionThresholdMinutes()));
            var orphaned = executionRepository.findStaleStarted(threshold);

            if (orphaned.isEmpty()) {
                log.debug("No orphaned executions found");
                return;
            }

            log.warn("Found {} orphaned executions, marking as failed", orphaned.size());

            var reaped = 0;
            for (JobExecution execution : orphaned) {
                var outcome = ExecutionOutcome.failure(ExecutionOutcome.ERROR_ORPHANED,
                        "Executor " + execution.getExecutorInstance() + " stopped before completing the execution");
                if (historyService.completeExecution(execution.getId(), outcome)) {
                    reaped++;
                }
            }
            log.info("Marked {} orphaned executions as {}", reaped, ExecutionStatus.FAILED);
        } catch (Exception e) {
            log.error("Error reaping orphaned executions: {}", e.getMessage(), e);
        }
    }
}
