package com.example.scanscheduler.service.engine;

import com.example.scanscheduler.config.ScanSchedulerProperties;
import com.example.scanscheduler.config.SchedulerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Holds at most one armed timer per schedule and hands due occurrences to
 * a bounded execution pool.
 * <p>
 * The timer thread never runs a scan. A schedule already executing on
 * this instance is not started a second time; the finishing run arms the
 * following occurrence.
 */
@Slf4j
@Component
public class SchedulingEngine {

    private final ScanJobRunner jobRunner;
    private final ScanSchedulerProperties properties;
    private final SchedulerMetrics metrics;

    private final Map<UUID, Slot> slots = new ConcurrentHashMap<>();
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean accepting = new AtomicBoolean(false);

    private ThreadPoolTaskScheduler timer;
    private ThreadPoolTaskExecutor executionPool;

    public SchedulingEngine(ScanJobRunner jobRunner, ScanSchedulerProperties properties, SchedulerMetrics metrics) {
        this.jobRunner = jobRunner;
        this.properties = properties;
        this.metrics = metrics;
        metrics.registerGauge("scheduled_occurrences", "Occurrences armed on this instance", slots::size);
        metrics.registerGauge("in_flight_executions", "Executions running on this instance", inFlight::size);
    }

    /**
     * Create the timer and execution pool and begin accepting occurrences
     */
    public synchronized void start() {
        if (accepting.get()) {
            return;
        }
        timer = new ThreadPoolTaskScheduler();
        timer.setPoolSize(1);
        timer.setThreadNamePrefix("scan-timer-");
        timer.setRemoveOnCancelPolicy(true);
        timer.initialize();

        var poolSize = properties.getMaxConcurrentExecutions();
        executionPool = new ThreadPoolTaskExecutor();
        executionPool.setCorePoolSize(poolSize);
        executionPool.setMaxPoolSize(poolSize);
        executionPool.setThreadNamePrefix("scan-exec-");
        executionPool.setWaitForTasksToCompleteOnShutdown(true);
        executionPool.setAwaitTerminationSeconds((int) properties.getShutdownGracePeriodSeconds());
        executionPool.initialize();

        accepting.set(true);
        log.info("Scheduling engine started with {} execution threads", poolSize);
    }

    /**
     * Arm or replace the timer for the occurrence's schedule
     */
    public void schedule(ScheduledOccurrence occurrence) {
        if (!accepting.get()) {
            log.debug("Engine not running, ignoring occurrence for schedule {}", occurrence.getScheduleId());
            return;
        }
        synchronized (slots) {
            replace(occurrence.getScheduleId(), occurrence);
        }
        log.debug("Armed schedule {} for {}", occurrence.getScheduleId(), occurrence.getTriggerAt());
    }

    public void reschedule(UUID scheduleId, ScheduledOccurrence occurrence) {
        if (!scheduleId.equals(occurrence.getScheduleId())) {
            throw new IllegalArgumentException("Occurrence belongs to schedule " + occurrence.getScheduleId() + ", not " + scheduleId);
        }
        schedule(occurrence);
    }

    /**
     * Disarm a schedule. An execution already running is not interrupted.
     *
     * @return true if the schedule was armed
     */
    public boolean unschedule(UUID scheduleId) {
        Slot removed;
        synchronized (slots) {
            removed = slots.remove(scheduleId);
        }
        if (removed == null) {
            return false;
        }
        removed.cancel();
        log.debug("Disarmed schedule {}", scheduleId);
        return true;
    }

    public Optional<ScheduledOccurrence> getScheduled(UUID scheduleId) {
        return Optional.ofNullable(slots.get(scheduleId)).map(slot -> slot.occurrence);
    }

    public int getScheduledCount() {
        return slots.size();
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    public boolean isRunning() {
        return accepting.get();
    }

    /**
     * Stop firing, then wait up to the shutdown grace period for running executions
     */
    public synchronized void stop() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        synchronized (slots) {
            slots.values().forEach(Slot::cancel);
            slots.clear();
        }
        timer.shutdown();

        log.info("Waiting up to {}s for {} running executions", properties.getShutdownGracePeriodSeconds(), inFlight.size());
        executionPool.shutdown();
        if (!inFlight.isEmpty()) {
            log.warn("Scheduling engine stopped with {} executions still running: {}", inFlight.size(), inFlight);
        } else {
            log.info("Scheduling engine stopped");
        }
    }

    private void replace(UUID scheduleId, ScheduledOccurrence occurrence) {
        var slot = new Slot(occurrence);
        var previous = slots.put(scheduleId, slot);
        if (previous != null) {
            previous.cancel();
        }
        slot.future = timer.schedule(() -> fire(slot), occurrence.getTriggerAt());
    }

    private void fire(Slot slot) {
        var occurrence = slot.occurrence;
        var scheduleId = occurrence.getScheduleId();
        if (slot.cancelled || !accepting.get()) {
            return;
        }
        if (!inFlight.add(scheduleId)) {
            log.info("Schedule {} is still running on this instance, skipping occurrence at {}", scheduleId, occurrence.getFireAt());
            metrics.recordSkipped("local_in_flight");
            return;
        }
        try {
            executionPool.execute(() -> execute(slot));
        } catch (TaskRejectedException e) {
            inFlight.remove(scheduleId);
            log.warn("Execution pool rejected schedule {}: {}", scheduleId, e.getMessage());
        }
    }

    private void execute(Slot firedSlot) {
        var occurrence = firedSlot.occurrence;
        var scheduleId = occurrence.getScheduleId();
        Optional<ScheduledOccurrence> next = Optional.empty();
        try {
            next = jobRunner.run(occurrence);
        } catch (RuntimeException e) {
            log.error("Unexpected error running schedule {}: {}", scheduleId, e.getMessage(), e);
        } finally {
            inFlight.remove(scheduleId);
        }
        rearm(firedSlot, next);
    }

    /**
     * Arm the occurrence that follows a finished run, unless the schedule
     * was disarmed while it ran
     */
    private void rearm(Slot firedSlot, Optional<ScheduledOccurrence> next) {
        var scheduleId = firedSlot.occurrence.getScheduleId();
        if (!accepting.get()) {
            return;
        }
        synchronized (slots) {
            var current = slots.get(scheduleId);
            if (current == null) {
                log.debug("Schedule {} was disarmed during its run, not re-arming", scheduleId);
                return;
            }
            if (next.isPresent()) {
                replace(scheduleId, next.get());
                log.debug("Re-armed schedule {} for {}", scheduleId, next.get().getTriggerAt());
            } else if (current == firedSlot) {
                slots.remove(scheduleId);
                log.debug("Schedule {} has no further occurrence", scheduleId);
            }
        }
    }

    private static final class Slot {

        private final ScheduledOccurrence occurrence;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private Slot(ScheduledOccurrence occurrence) {
            this.occurrence = occurrence;
        }

        private void cancel() {
            cancelled = true;
            var pending = future;
            if (pending != null) {
                pending.cancel(false);
            }
        }
    }
}
