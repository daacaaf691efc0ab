package com.example.scanscheduler.service.coordinator;

import com.example.scanscheduler.config.ScanSchedulerProperties;
import com.example.scanscheduler.domain.entity.ScanSchedule;
import com.example.scanscheduler.exception.InvalidScheduleDefinitionException;
import com.example.scanscheduler.service.engine.ScheduledOccurrence;
import com.example.scanscheduler.service.engine.SchedulingEngine;
import com.example.scanscheduler.service.schedule.ScheduleStore;
import com.example.scanscheduler.service.timing.NextRunCalculator;
import com.example.scanscheduler.service.watcher.ScheduleChangeWatcher;
import com.example.scanscheduler.service.watcher.ScheduleDelta;
import com.example.scanscheduler.service.watcher.ScheduleFingerprinter;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the scheduler lifecycle on this instance.
 * <p>
 * On start it loads the enabled schedules into the engine, retrying with
 * exponential backoff while the store is unreachable, then applies the
 * change watcher's deltas on a fixed delay. It owns the canonical map of
 * known schedule fingerprints; all changes to it and to the engine's
 * armed set go through this class one at a time.
 */
@Slf4j
@Service
public class SchedulerCoordinator implements SmartLifecycle {

    private final ScheduleStore scheduleStore;
    private final ScheduleChangeWatcher changeWatcher;
    private final ScheduleFingerprinter fingerprinter;
    private final SchedulingEngine engine;
    private final NextRunCalculator nextRunCalculator;
    private final ScanSchedulerProperties properties;
    private final Clock clock;
    private final IntervalFunction startupBackoff;

    private final AtomicReference<CoordinatorState> state = new AtomicReference<>(CoordinatorState.STOPPED);
    private final Map<UUID, String> knownFingerprints = new HashMap<>();

    private ThreadPoolTaskScheduler coordinatorScheduler;
    private ScheduledFuture<?> pendingStartup;
    private ScheduledFuture<?> watcherLoop;
    private int startupAttempts;

    public SchedulerCoordinator(ScheduleStore scheduleStore, ScheduleChangeWatcher changeWatcher,
                                ScheduleFingerprinter fingerprinter, SchedulingEngine engine,
                                NextRunCalculator nextRunCalculator, ScanSchedulerProperties properties, Clock clock) {
        this.scheduleStore = scheduleStore;
        this.changeWatcher = changeWatcher;
        this.fingerprinter = fingerprinter;
        this.engine = engine;
        this.nextRunCalculator = nextRunCalculator;
        this.properties = properties;
        this.clock = clock;
        this.startupBackoff = IntervalFunction.ofExponentialBackoff(
                properties.getStartupBackoffInitialMs(), 2.0, properties.getStartupBackoffMaxMs());
    }

    // === Lifecycle ===

    /**
     * Begin startup in the background; the application context does not
     * wait for the schedule store to become reachable
     */
    @Override
    public synchronized void start() {
        if (!state.compareAndSet(CoordinatorState.STOPPED, CoordinatorState.STARTING)) {
            log.debug("Coordinator already {}", state.get());
            return;
        }
        log.info("Starting scheduler coordinator");

        coordinatorScheduler = new ThreadPoolTaskScheduler();
        coordinatorScheduler.setPoolSize(1);
        coordinatorScheduler.setThreadNamePrefix("scan-coordinator-");
        coordinatorScheduler.initialize();

        engine.start();
        startupAttempts = 0;
        pendingStartup = coordinatorScheduler.schedule(this::attemptStartup, clock.instant());
    }

    @Override
    public void stop() {
        CoordinatorState previous;
        synchronized (this) {
            previous = state.get();
            if (previous == CoordinatorState.STOPPED || previous == CoordinatorState.STOPPING) {
                return;
            }
            state.set(CoordinatorState.STOPPING);
            log.info("Stopping scheduler coordinator (was {})", previous);

            cancel(pendingStartup);
            cancel(watcherLoop);
            pendingStartup = null;
            watcherLoop = null;
        }

        // Outside the lock so a running watcher cycle can finish
        engine.stop();
        coordinatorScheduler.shutdown();

        synchronized (this) {
            knownFingerprints.clear();
            state.set(CoordinatorState.STOPPED);
        }
        log.info("Scheduler coordinator stopped");
    }

    @Override
    public boolean isRunning() {
        var current = state.get();
        return current == CoordinatorState.STARTING || current == CoordinatorState.RUNNING;
    }

    public CoordinatorState getState() {
        return state.get();
    }

    public int getScheduledCount() {
        return engine.getScheduledCount();
    }

    public synchronized int getKnownCount() {
        return knownFingerprints.size();
    }

    // === Startup ===

    /**
     * One attempt to load all enabled schedules. On failure the next
     * attempt is scheduled with exponential backoff.
     *
     * @return true if the coordinator is now running
     */
    synchronized boolean attemptStartup() {
        if (state.get() != CoordinatorState.STARTING) {
            return false;
        }
        startupAttempts++;

        try {
            var schedules = scheduleStore.listEnabled();
            for (var schedule : schedules) {
                arm(schedule, true);
                knownFingerprints.put(schedule.getId(), fingerprinter.fingerprint(schedule));
            }
            log.info("Loaded {} enabled schedules after {} attempt(s)", schedules.size(), startupAttempts);
        } catch (RuntimeException e) {
            knownFingerprints.clear();
            var delay = backoffDelay(startupAttempts);
            log.warn("Startup attempt {} failed, retrying in {}ms: {}", startupAttempts, delay.toMillis(), e.getMessage());
            pendingStartup = coordinatorScheduler.schedule(this::attemptStartup, clock.instant().plus(delay));
            return false;
        }

        state.set(CoordinatorState.RUNNING);
        pendingStartup = null;
        var interval = Duration.ofMillis(properties.getWatcherIntervalMs());
        watcherLoop = coordinatorScheduler.scheduleWithFixedDelay(this::runWatcherCycle, clock.instant().plus(interval), interval);
        log.info("Scheduler coordinator running, watching for changes every {}s", interval.toSeconds());
        return true;
    }

    /**
     * Delay before the next startup attempt: initial, doubled per attempt, capped
     */
    Duration backoffDelay(int attempt) {
        return Duration.ofMillis(startupBackoff.apply(attempt));
    }

    // === Watcher ===

    /**
     * Apply one change watcher cycle to the engine
     */
    public synchronized void runWatcherCycle() {
        if (state.get() != CoordinatorState.RUNNING) {
            return;
        }
        try {
            var delta = changeWatcher.diff(Map.copyOf(knownFingerprints));
            if (!delta.isSkipped()) {
                apply(delta);
            }
        } catch (RuntimeException e) {
            log.error("Error in watcher cycle: {}", e.getMessage(), e);
        }
    }

    private void apply(ScheduleDelta delta) {
        for (var scheduleId : delta.getRemoved()) {
            engine.unschedule(scheduleId);
            knownFingerprints.remove(scheduleId);
            log.info("Schedule {} removed", scheduleId);
        }
        for (var schedule : delta.getAdded()) {
            arm(schedule, false);
            knownFingerprints.put(schedule.getId(), delta.getFingerprints().get(schedule.getId()));
            log.info("Schedule {} added ({} {})", schedule.getId(), schedule.getFrequency(), schedule.getDomain());
        }
        for (var schedule : delta.getUpdated()) {
            var occurrence = occurrenceFor(schedule);
            if (occurrence.isPresent()) {
                engine.reschedule(schedule.getId(), occurrence.get());
            } else {
                engine.unschedule(schedule.getId());
            }
            knownFingerprints.put(schedule.getId(), delta.getFingerprints().get(schedule.getId()));
            log.info("Schedule {} updated, next run at {}", schedule.getId(), occurrence.map(ScheduledOccurrence::getFireAt).orElse(null));
        }
    }

    private void arm(ScanSchedule schedule, boolean initialLoad) {
        occurrenceFor(schedule).ifPresent(occurrence -> {
            if (initialLoad && occurrence.getFireAt().isBefore(clock.instant())) {
                log.info("Schedule {} missed its run at {}, catching up once", schedule.getId(), occurrence.getFireAt());
            }
            engine.schedule(occurrence);
        });
    }

    /**
     * Occurrence at the stored next run. A past value yields a single
     * immediate catch-up run.
     */
    private Optional<ScheduledOccurrence> occurrenceFor(ScanSchedule schedule) {
        if (schedule.getNextRun() != null) {
            return Optional.of(ScheduledOccurrence.of(schedule, schedule.getNextRun()));
        }
        try {
            return Optional.of(ScheduledOccurrence.of(schedule, nextRunCalculator.nextRun(schedule, clock.instant())));
        } catch (InvalidScheduleDefinitionException e) {
            log.error("Schedule {} has an invalid definition and will not run: {}", schedule.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }
}
