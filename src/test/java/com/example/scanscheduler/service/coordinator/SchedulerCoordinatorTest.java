package com.example.scanscheduler.service.coordinator;

import com.example.scanscheduler.config.ScanSchedulerProperties;
import com.example.scanscheduler.config.SchedulerMetrics;
import com.example.scanscheduler.domain.entity.ScanSchedule;
import com.example.scanscheduler.domain.enums.ScheduleFrequency;
import com.example.scanscheduler.service.engine.ScheduledOccurrence;
import com.example.scanscheduler.service.engine.SchedulingEngine;
import com.example.scanscheduler.service.schedule.ScheduleStore;
import com.example.scanscheduler.service.timing.NextRunCalculator;
import com.example.scanscheduler.service.watcher.ScheduleChangeWatcher;
import com.example.scanscheduler.service.watcher.ScheduleFingerprinter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchedulerCoordinator Tests")
class SchedulerCoordinatorTest {

    @Mock
    private ScheduleStore scheduleStore;

    @Mock
    private SchedulingEngine engine;

    @Mock
    private SchedulerMetrics metrics;

    private final ScheduleFingerprinter fingerprinter = new ScheduleFingerprinter();

    private ScanSchedulerProperties properties;

    private SchedulerCoordinator coordinator;

    private ScanSchedule daily;

    @BeforeEach
    void setUp() {
        properties = new ScanSchedulerProperties();
        properties.setStartupBackoffInitialMs(50);
        properties.setStartupBackoffMaxMs(200);
        properties.setWatcherIntervalMs(600_000);

        var watcher = new ScheduleChangeWatcher(scheduleStore, fingerprinter, metrics);
        coordinator = new SchedulerCoordinator(scheduleStore, watcher, fingerprinter, engine,
                new NextRunCalculator(ZoneId.of("UTC")), properties, Clock.systemUTC());

        daily = ScanSchedule.builder()
                .id(UUID.randomUUID())
                .domain("example.com")
                .frequency(ScheduleFrequency.DAILY)
                .timeConfig(new HashMap<>(Map.of("hour", 2, "minute", 0)))
                .nextRun(Instant.now().plus(Duration.ofHours(3)))
                .build();
    }

    @AfterEach
    void tearDown() {
        coordinator.stop();
    }

    private void startAndAwaitRunning() {
        coordinator.start();
        waitUntil(() -> coordinator.getState() == CoordinatorState.RUNNING);
    }

    @Nested
    @DisplayName("Startup Tests")
    class StartupTests {

        @Test
        @DisplayName("Should arm every enabled schedule at its stored next run")
        void shouldArmEnabledSchedules() {
            // Given
            when(scheduleStore.listEnabled()).thenReturn(List.of(daily));

            // When
            startAndAwaitRunning();

            // Then
            verify(engine).start();
            var captor = ArgumentCaptor.forClass(ScheduledOccurrence.class);
            verify(engine).schedule(captor.capture());
            assertThat(captor.getValue().getScheduleId()).isEqualTo(daily.getId());
            assertThat(captor.getValue().getFireAt()).isEqualTo(daily.getNextRun());
            assertThat(coordinator.getKnownCount()).isEqualTo(1);
            assertThat(coordinator.isRunning()).isTrue();
        }

        @Test
        @DisplayName("Should catch up a missed run once")
        void shouldCatchUpMissedRun() {
            // Given
            var missed = Instant.now().minus(Duration.ofHours(5));
            daily.setNextRun(missed);
            when(scheduleStore.listEnabled()).thenReturn(List.of(daily));

            // When
            startAndAwaitRunning();

            // Then
            var captor = ArgumentCaptor.forClass(ScheduledOccurrence.class);
            verify(engine, times(1)).schedule(captor.capture());
            assertThat(captor.getValue().getFireAt()).isEqualTo(missed);
        }

        @Test
        @DisplayName("Should compute the next run when none is stored")
        void shouldComputeMissingNextRun() {
            // Given
            daily.setNextRun(null);
            when(scheduleStore.listEnabled()).thenReturn(List.of(daily));

            // When
            startAndAwaitRunning();

            // Then
            var captor = ArgumentCaptor.forClass(ScheduledOccurrence.class);
            verify(engine).schedule(captor.capture());
            assertThat(captor.getValue().getFireAt()).isAfter(Instant.now().minusSeconds(5));
        }

        @Test
        @DisplayName("Should stay STARTING and retry while the store is unreachable")
        void shouldRetryStartupWithBackoff() {
            // Given
            when(scheduleStore.listEnabled())
                    .thenThrow(new DataAccessResourceFailureException("connection refused"))
                    .thenThrow(new DataAccessResourceFailureException("connection refused"))
                    .thenReturn(List.of(daily));

            // When
            coordinator.start();

            // Then
            verify(scheduleStore, timeout(5000).times(3)).listEnabled();
            waitUntil(() -> coordinator.getState() == CoordinatorState.RUNNING);
            verify(engine, times(1)).schedule(any());
            assertThat(coordinator.getKnownCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Backoff delay should double per attempt up to the maximum")
        void backoffDelayShouldDoubleUpToMaximum() {
            assertThat(coordinator.backoffDelay(1)).isEqualTo(Duration.ofMillis(50));
            assertThat(coordinator.backoffDelay(2)).isEqualTo(Duration.ofMillis(100));
            assertThat(coordinator.backoffDelay(3)).isEqualTo(Duration.ofMillis(200));
            assertThat(coordinator.backoffDelay(8)).isEqualTo(Duration.ofMillis(200));
        }
    }

    @Nested
    @DisplayName("Watcher Cycle Tests")
    class WatcherCycleTests {

        @Test
        @DisplayName("Should disarm a schedule that was disabled")
        void shouldDisarmDisabledSchedule() {
            // Given
            when(scheduleStore.listEnabled()).thenReturn(List.of(daily), List.of());
            startAndAwaitRunning();

            // When
            coordinator.runWatcherCycle();

            // Then
            verify(engine).unschedule(daily.getId());
            assertThat(coordinator.getKnownCount()).isZero();
        }

        @Test
        @DisplayName("Should arm a newly added schedule")
        void shouldArmAddedSchedule() {
            // Given
            when(scheduleStore.listEnabled()).thenReturn(List.of(), List.of(daily));
            startAndAwaitRunning();

            // When
            coordinator.runWatcherCycle();

            // Then
            verify(engine).schedule(any(ScheduledOccurrence.class));
            assertThat(coordinator.getKnownCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should re-arm a schedule whose definition changed")
        void shouldRearmUpdatedSchedule() {
            // Given
            var changed = ScanSchedule.builder()
                    .id(daily.getId())
                    .domain(daily.getDomain())
                    .frequency(ScheduleFrequency.HOURLY)
                    .timeConfig(new HashMap<>(Map.of("minute", 30)))
                    .nextRun(Instant.now().plus(Duration.ofMinutes(20)))
                    .build();
            when(scheduleStore.listEnabled()).thenReturn(List.of(daily), List.of(changed));
            startAndAwaitRunning();

            // When
            coordinator.runWatcherCycle();

            // Then
            var captor = ArgumentCaptor.forClass(ScheduledOccurrence.class);
            verify(engine).reschedule(eq(daily.getId()), captor.capture());
            assertThat(captor.getValue().getFireAt()).isEqualTo(changed.getNextRun());
        }

        @Test
        @DisplayName("Should leave the engine untouched when nothing changed")
        void shouldDoNothingWithoutChanges() {
            // Given
            when(scheduleStore.listEnabled()).thenReturn(List.of(daily));
            startAndAwaitRunning();

            // When
            coordinator.runWatcherCycle();

            // Then
            verify(engine, times(1)).schedule(any());
            verify(engine, never()).reschedule(any(), any());
            verify(engine, never()).unschedule(any());
        }

        @Test
        @DisplayName("Should keep the armed set when the store fails during a cycle")
        void shouldKeepArmedSetOnStoreFailure() {
            // Given
            when(scheduleStore.listEnabled())
                    .thenReturn(List.of(daily))
                    .thenThrow(new DataAccessResourceFailureException("connection reset"));
            startAndAwaitRunning();

            // When
            coordinator.runWatcherCycle();

            // Then
            verify(engine, never()).unschedule(any());
            assertThat(coordinator.getKnownCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should stop the engine and forget known schedules on stop")
    void shouldStopEngine() {
        // Given
        when(scheduleStore.listEnabled()).thenReturn(List.of(daily));
        startAndAwaitRunning();

        // When
        coordinator.stop();

        // Then
        verify(engine).stop();
        assertThat(coordinator.getState()).isEqualTo(CoordinatorState.STOPPED);
        assertThat(coordinator.getKnownCount()).isZero();
        assertThat(coordinator.isRunning()).isFalse();
    }

    private static void waitUntil(BooleanSupplier condition) {
        var deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within 5s");
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
        }
    }
}
