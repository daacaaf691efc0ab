package com.example.scanscheduler.service.schedule;

import com.example.scanscheduler.domain.entity.ScanSchedule;
import com.example.scanscheduler.domain.enums.ExecutionStatus;
import com.example.scanscheduler.domain.enums.ScanType;
import com.example.scanscheduler.domain.repository.JobExecutionRepository;
import com.example.scanscheduler.domain.repository.ScanScheduleRepository;
import com.example.scanscheduler.dto.CreateScheduleRequest;
import com.example.scanscheduler.dto.UpdateScheduleRequest;
import com.example.scanscheduler.exception.InvalidScheduleDefinitionException;
import com.example.scanscheduler.service.timing.NextRunCalculator;
import com.example.scanscheduler.service.timing.TimeSpecParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read and write access to persisted scan schedules.
 * <p>
 * Every mutation validates the time spec and recomputes {@code nextRun}
 * in the same transaction that locks the row, so a concurrent edit and a
 * run completion cannot overwrite each other's result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleStore {

    private final ScanScheduleRepository scheduleRepository;
    private final JobExecutionRepository executionRepository;
    private final NextRunCalculator nextRunCalculator;
    private final Clock clock;

    // === Queries ===

    @Transactional(readOnly = true)
    public List<ScanSchedule> listEnabled() {
        return scheduleRepository.findByEnabledTrueOrderByDomainAscCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public List<ScanSchedule> listAll() {
        return scheduleRepository.findAllByOrderByDomainAscCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public List<ScanSchedule> listByDomain(String domain) {
        return scheduleRepository.findByDomainOrderByCreatedAtAsc(domain);
    }

    @Transactional(readOnly = true)
    public Optional<ScanSchedule> get(UUID scheduleId) {
        return scheduleRepository.findById(scheduleId);
    }

    // === Definition Changes ===

    /**
     * Create a schedule with its first run time computed from now
     *
     * @throws InvalidScheduleDefinitionException if the time config does not fit the frequency
     */
    @Transactional
    public ScanSchedule create(CreateScheduleRequest request) {
        log.info("Creating {} schedule for domain {}", request.getFrequency(), request.getDomain());

        var timeSpec = TimeSpecParser.parse(request.getFrequency(), request.getTimeConfig());

        var schedule = ScanSchedule.builder()
                .domain(request.getDomain())
                .domainConfigId(request.getDomainConfigId())
                .profileId(request.getProfileId())
                .frequency(request.getFrequency())
                .timeConfig(request.getTimeConfig() != null ? new HashMap<>(request.getTimeConfig()) : new HashMap<>())
                .enabled(request.isEnabled())
                .scanType(request.getScanType() != null ? request.getScanType() : ScanType.QUICK)
                .scanParams(request.getScanParams() != null ? new HashMap<>(request.getScanParams()) : new HashMap<>())
                .description(request.getDescription())
                .createdBy(request.getCreatedBy())
                .nextRun(nextRunCalculator.nextRun(timeSpec, clock.instant()))
                .build();

        schedule = scheduleRepository.save(schedule);
        log.info("Created schedule {} for domain {}, next run at {}", schedule.getId(), schedule.getDomain(), schedule.getNextRun());

        return schedule;
    }

    /**
     * Apply the non-null fields of {@code patch}. A schedule whose lease is
     * currently held may be updated; the change applies from its next occurrence.
     *
     * @return the updated schedule, or empty if it does not exist
     * @throws InvalidScheduleDefinitionException if the resulting time config does not fit the frequency
     */
    @Transactional
    public Optional<ScanSchedule> update(UUID scheduleId, UpdateScheduleRequest patch) {
        var found = scheduleRepository.findByIdForUpdate(scheduleId);
        if (found.isEmpty()) {
            log.warn("Cannot update schedule {}: not found", scheduleId);
            return Optional.empty();
        }
        var schedule = found.get();

        if (patch.getDomain() != null) {
            schedule.setDomain(patch.getDomain());
        }
        if (patch.getProfileId() != null) {
            schedule.setProfileId(patch.getProfileId());
        }
        if (patch.getFrequency() != null) {
            schedule.setFrequency(patch.getFrequency());
        }
        if (patch.getTimeConfig() != null) {
            schedule.setTimeConfig(new HashMap<>(patch.getTimeConfig()));
        }
        if (patch.getEnabled() != null) {
            schedule.setEnabled(patch.getEnabled());
        }
        if (patch.getScanType() != null) {
            schedule.setScanType(patch.getScanType());
        }
        if (patch.getScanParams() != null) {
            schedule.setScanParams(new HashMap<>(patch.getScanParams()));
        }
        if (patch.getDescription() != null) {
            schedule.setDescription(patch.getDescription());
        }

        var timeSpec = TimeSpecParser.parse(schedule.getFrequency(), schedule.getTimeConfig());
        schedule.setNextRun(nextRunCalculator.nextRun(timeSpec, clock.instant()));

        schedule = scheduleRepository.save(schedule);
        log.info("Updated schedule {} (enabled: {}, next run at {})", scheduleId, schedule.isEnabled(), schedule.getNextRun());

        return Optional.of(schedule);
    }

    /**
     * Delete a schedule, keeping its execution history
     *
     * @return true if the schedule existed
     */
    @Transactional
    public boolean delete(UUID scheduleId) {
        if (scheduleRepository.findByIdForUpdate(scheduleId).isEmpty()) {
            return false;
        }
        var detached = executionRepository.detachSchedule(scheduleId);
        scheduleRepository.deleteById(scheduleId);
        log.info("Deleted schedule {} ({} execution records kept)", scheduleId, detached);
        return true;
    }

    // === Run Bookkeeping ===

    /**
     * Record that this instance started the occurrence. Instances that
     * fire the same occurrence later see it via
     * {@link ScanSchedule#hasStartedOccurrence(Instant)}.
     *
     * @return false if the schedule no longer exists
     */
    @Transactional
    public boolean markRunStart(UUID scheduleId, Instant startedAt) {
        return scheduleRepository.markRunStart(scheduleId, startedAt, clock.instant()) > 0;
    }

    /**
     * Record a finished run and compute the following occurrence from the
     * definition as currently stored, strictly after {@code completedAt}
     *
     * @return the updated schedule, or empty if it was deleted meanwhile
     */
    @Transactional
    public Optional<ScanSchedule> markRunResult(UUID scheduleId, Instant completedAt, ExecutionStatus status) {
        var found = scheduleRepository.findByIdForUpdate(scheduleId);
        if (found.isEmpty()) {
            log.info("Schedule {} was deleted while running, result {} not recorded on it", scheduleId, status);
            return Optional.empty();
        }
        var schedule = found.get();
        schedule.setLastRun(completedAt);
        schedule.setLastStatus(status);
        try {
            schedule.setNextRun(nextRunCalculator.nextRun(schedule, completedAt));
        } catch (InvalidScheduleDefinitionException e) {
            log.error("Schedule {} has an invalid stored definition, clearing next run: {}", scheduleId, e.getMessage());
            schedule.setNextRun(null);
        }

        schedule = scheduleRepository.save(schedule);
        log.debug("Schedule {} finished with {}, next run at {}", scheduleId, status, schedule.getNextRun());

        return Optional.of(schedule);
    }
}
