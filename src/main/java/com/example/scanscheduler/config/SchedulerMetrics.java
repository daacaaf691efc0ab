package com.example.scanscheduler.config;

import com.example.scanscheduler.domain.enums.ExecutionStatus;
import com.example.scanscheduler.domain.repository.ScanScheduleRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Metrics for monitoring scheduler health and performance.
 * <p>
 * Exposes Prometheus metrics for:
 * - Occurrences fired and skipped
 * - Executions by outcome and their duration
 * - Watcher changes and errors
 * - Scheduled, in-flight and enabled schedule counts
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerMetrics {

    private final MeterRegistry meterRegistry;
    private final ScanScheduleRepository scheduleRepository;

    private final AtomicLong enabledSchedules = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("scan_scheduler_enabled_schedules", enabledSchedules, AtomicLong::get)
                .description("Number of enabled schedules in the store")
                .register(meterRegistry);
    }

    /**
     * Periodically refresh the enabled schedule gauge from the database
     */
    @Scheduled(fixedDelayString = "${scan-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            enabledSchedules.set(scheduleRepository.countByEnabledTrue());
        } catch (DataAccessException e) {
            log.debug("Could not refresh schedule metrics: {}", e.getMessage());
        }
    }

    /**
     * Register a gauge backed by a live value, e.g. the engine's scheduled count
     */
    public void registerGauge(String name, String description, Supplier<Number> value) {
        Gauge.builder("scan_scheduler_" + name, value)
                .description(description)
                .register(meterRegistry);
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record execution time tagged with its final status
     */
    public void recordExecution(Timer.Sample sample, ExecutionStatus status, String errorType) {
        sample.stop(Timer.builder("scan_scheduler_execution_time")
                .tag("status", status.getCode())
                .description("Scan execution time")
                .register(meterRegistry));
        meterRegistry.counter("scan_scheduler_executions",
                "status", status.getCode(),
                "error_type", errorType != null ? errorType : "none"
        ).increment();
    }

    public void recordFired() {
        meterRegistry.counter("scan_scheduler_occurrences_fired").increment();
    }

    /**
     * Record an occurrence that was not executed on this instance
     *
     * @param reason lease_contention, local_in_flight, already_started, disabled
     */
    public void recordSkipped(String reason) {
        meterRegistry.counter("scan_scheduler_occurrences_skipped", "reason", reason).increment();
    }

    public void recordWatcherChanges(int added, int updated, int removed) {
        meterRegistry.counter("scan_scheduler_watcher_changes", "change", "added").increment(added);
        meterRegistry.counter("scan_scheduler_watcher_changes", "change", "updated").increment(updated);
        meterRegistry.counter("scan_scheduler_watcher_changes", "change", "removed").increment(removed);
    }

    public void recordWatcherError() {
        meterRegistry.counter("scan_scheduler_watcher_errors").increment();
    }
}
