package com.example.scanscheduler.service.engine;

import com.example.scanscheduler.client.ScanTaskClient;
import com.example.scanscheduler.client.ScanTaskModels.ScanTaskResult;
import com.example.scanscheduler.config.ScanSchedulerProperties;
import com.example.scanscheduler.config.SchedulerMetrics;
import com.example.scanscheduler.domain.entity.JobExecution;
import com.example.scanscheduler.domain.entity.ScanSchedule;
import com.example.scanscheduler.domain.enums.ExecutionStatus;
import com.example.scanscheduler.domain.enums.ScheduleFrequency;
import com.example.scanscheduler.exception.ScanTaskException;
import com.example.scanscheduler.exception.TransientInfrastructureException;
import com.example.scanscheduler.service.history.ExecutionHistoryService;
import com.example.scanscheduler.service.history.ExecutionOutcome;
import com.example.scanscheduler.service.lease.LeaseManager;
import com.example.scanscheduler.service.lease.LeaseOutcome;
import com.example.scanscheduler.service.lease.LeaseToken;
import com.example.scanscheduler.service.schedule.ScheduleStore;
import com.example.scanscheduler.service.timing.NextRunCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScanJobRunner Tests")
class ScanJobRunnerTest {

    private static final Instant FIRE_AT = Instant.parse("2025-01-01T02:00:00Z");
    private static final Instant NOW = FIRE_AT.plusSeconds(1);
    private static final Instant NEXT_DAY = Instant.parse("2025-01-02T02:00:00Z");

    @Mock
    private LeaseManager leaseManager;

    @Mock
    private ScheduleStore scheduleStore;

    @Mock
    private ExecutionHistoryService historyService;

    @Mock
    private ScanTaskClient scanTaskClient;

    @Mock
    private SchedulerMetrics metrics;

    private ScanSchedulerProperties properties;

    private ScanJobRunner runner;

    private ScanSchedule schedule;
    private String leaseKey;
    private LeaseToken token;
    private JobExecution execution;

    @BeforeEach
    void setUp() {
        properties = new ScanSchedulerProperties();
        properties.setLeaseTtlSeconds(1800);
        properties.setLeaseRenewIntervalSeconds(300);
        properties.setTaskSoftTimeoutSeconds(1200);

        runner = new ScanJobRunner(leaseManager, scheduleStore, historyService, scanTaskClient,
                new NextRunCalculator(ZoneId.of("UTC")), properties, metrics, Clock.fixed(NOW, ZoneOffset.UTC));

        schedule = ScanSchedule.builder()
                .id(UUID.randomUUID())
                .domain("example.com")
                .frequency(ScheduleFrequency.DAILY)
                .timeConfig(new HashMap<>(Map.of("hour", 2, "minute", 0)))
                .nextRun(FIRE_AT)
                .build();
        leaseKey = LeaseManager.scheduleKey(schedule.getId());
        token = new LeaseToken(leaseKey, "node-a:1", NOW.plusSeconds(1800));
        execution = JobExecution.builder()
                .id(UUID.randomUUID())
                .scheduleId(schedule.getId())
                .status(ExecutionStatus.STARTED)
                .startedAt(NOW)
                .build();
    }

    private void givenLeaseAndSchedule() {
        when(leaseManager.tryAcquire(eq(leaseKey), any())).thenReturn(Optional.of(token));
        when(scheduleStore.get(schedule.getId())).thenReturn(Optional.of(schedule));
    }

    private void givenExecutionRecorded() {
        when(historyService.startExecution(eq(schedule), eq(FIRE_AT), anyMap())).thenReturn(execution);
        lenient().when(scheduleStore.markRunResult(eq(schedule.getId()), any(), any())).thenAnswer(inv -> {
            schedule.setNextRun(NEXT_DAY);
            schedule.setLastStatus(inv.getArgument(2));
            return Optional.of(schedule);
        });
    }

    private ExecutionOutcome capturedOutcome() {
        var captor = ArgumentCaptor.forClass(ExecutionOutcome.class);
        verify(historyService).completeExecution(eq(execution.getId()), captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Successful Run Tests")
    class SuccessfulRunTests {

        @Test
        @DisplayName("Should run the scan, record success and arm the next day")
        void shouldRunAndRecordSuccess() {
            // Given
            givenLeaseAndSchedule();
            givenExecutionRecorded();
            when(scanTaskClient.submit(any())).thenReturn(CompletableFuture.completedFuture(
                    ScanTaskResult.builder().scanId("scan-42").status("completed").build()));

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            var outcome = capturedOutcome();
            assertThat(outcome.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
            assertThat(outcome.getScanId()).isEqualTo("scan-42");
            verify(scheduleStore).markRunStart(schedule.getId(), NOW);
            verify(scheduleStore).markRunResult(schedule.getId(), NOW, ExecutionStatus.SUCCESS);
            verify(leaseManager).release(leaseKey, token);
            assertThat(next).isPresent();
            assertThat(next.get().getFireAt()).isEqualTo(NEXT_DAY);
        }

        @Test
        @DisplayName("Should record a failed status reported by the scan service")
        void shouldRecordTaskFailure() {
            // Given
            givenLeaseAndSchedule();
            givenExecutionRecorded();
            when(scanTaskClient.submit(any())).thenReturn(CompletableFuture.completedFuture(
                    ScanTaskResult.builder().scanId("scan-43").status("failed").error("robots.txt disallows").build()));

            // When
            runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            var outcome = capturedOutcome();
            assertThat(outcome.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(outcome.getErrorType()).isEqualTo(ExecutionOutcome.ERROR_TASK_FAILED);
            assertThat(outcome.getErrorMessage()).isEqualTo("robots.txt disallows");
        }

        @Test
        @DisplayName("Should record the exception when the scan call fails")
        void shouldRecordTaskException() {
            // Given
            givenLeaseAndSchedule();
            givenExecutionRecorded();
            when(scanTaskClient.submit(any())).thenReturn(CompletableFuture.failedFuture(new ScanTaskException(503, "busy")));

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            var outcome = capturedOutcome();
            assertThat(outcome.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(outcome.getErrorType()).isEqualTo("ScanTaskException");
            verify(leaseManager).release(leaseKey, token);
            assertThat(next).isPresent();
        }
    }

    @Nested
    @DisplayName("Skip Tests")
    class SkipTests {

        @Test
        @DisplayName("Should skip without a record when another instance holds the lease")
        void shouldSkipOnContention() {
            // Given
            when(leaseManager.tryAcquire(eq(leaseKey), any())).thenReturn(Optional.empty());

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            verify(metrics).recordSkipped("lease_contention");
            verifyNoInteractions(historyService, scanTaskClient);
            verify(scheduleStore, never()).get(any());
            assertThat(next.orElseThrow().getFireAt()).isEqualTo(NEXT_DAY);
        }

        @Test
        @DisplayName("Should record a CANCELLED skip when contention recording is on")
        void shouldRecordContentionWhenEnabled() {
            // Given
            properties.setRecordContentionSkips(true);
            when(leaseManager.tryAcquire(eq(leaseKey), any())).thenReturn(Optional.empty());

            // When
            runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            verify(historyService).recordContentionSkip(schedule, FIRE_AT);
            verifyNoInteractions(scanTaskClient);
        }

        @Test
        @DisplayName("Should arm an upcoming occurrence after a contended catch-up days in the past")
        void shouldNotRefireContendedCatchUp() {
            // Given
            properties.setRecordContentionSkips(true);
            schedule.setFrequency(ScheduleFrequency.HOURLY);
            schedule.setTimeConfig(new HashMap<>(Map.of("minute", 0)));
            var missed = FIRE_AT.minus(Duration.ofDays(2));
            when(leaseManager.tryAcquire(eq(leaseKey), any())).thenReturn(Optional.empty());

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, missed));

            // Then
            verify(historyService, times(1)).recordContentionSkip(schedule, missed);
            assertThat(next.orElseThrow().getFireAt())
                    .isAfter(NOW)
                    .isEqualTo(Instant.parse("2025-01-01T03:00:00Z"));
        }

        @Test
        @DisplayName("Should arm an upcoming occurrence when a started catch-up has a stale next run")
        void shouldNotRefireStartedCatchUp() {
            // Given
            var missed = FIRE_AT.minus(Duration.ofDays(2));
            schedule.setLastRunStartedAt(missed.plusSeconds(60));
            schedule.setNextRun(FIRE_AT.minus(Duration.ofDays(1)));
            givenLeaseAndSchedule();

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, missed));

            // Then
            verify(metrics).recordSkipped("already_started");
            assertThat(next.orElseThrow().getFireAt()).isEqualTo(NEXT_DAY);
        }

        @Test
        @DisplayName("Should skip an occurrence another instance already started")
        void shouldSkipAlreadyStarted() {
            // Given
            schedule.setLastRunStartedAt(FIRE_AT.plusMillis(200));
            schedule.setNextRun(NEXT_DAY);
            givenLeaseAndSchedule();

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            verify(metrics).recordSkipped("already_started");
            verify(leaseManager).release(leaseKey, token);
            verifyNoInteractions(historyService, scanTaskClient);
            assertThat(next.orElseThrow().getFireAt()).isEqualTo(NEXT_DAY);
        }

        @Test
        @DisplayName("Should not run a disabled schedule")
        void shouldSkipDisabled() {
            // Given
            schedule.setEnabled(false);
            givenLeaseAndSchedule();

            // When
            runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            verify(metrics).recordSkipped("disabled");
            verify(leaseManager).release(leaseKey, token);
            verifyNoInteractions(historyService, scanTaskClient);
        }

        @Test
        @DisplayName("Should drop the occurrence when the schedule was deleted")
        void shouldDropDeletedSchedule() {
            // Given
            when(leaseManager.tryAcquire(eq(leaseKey), any())).thenReturn(Optional.of(token));
            when(scheduleStore.get(schedule.getId())).thenReturn(Optional.empty());

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            assertThat(next).isEmpty();
            verify(leaseManager).release(leaseKey, token);
            verifyNoInteractions(historyService, scanTaskClient);
        }
    }

    @Nested
    @DisplayName("Failure Handling Tests")
    class FailureHandlingTests {

        @Test
        @DisplayName("Should retry the same occurrence later when the lease store is down")
        void shouldRetryWhenLeaseStoreDown() {
            // Given
            when(leaseManager.tryAcquire(eq(leaseKey), any()))
                    .thenThrow(new TransientInfrastructureException("down", new RuntimeException()));

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            assertThat(next.orElseThrow().getFireAt()).isEqualTo(FIRE_AT);
            assertThat(next.get().getTriggerAt()).isEqualTo(NOW.plus(ScanJobRunner.STORE_RETRY_DELAY));
            verifyNoInteractions(historyService, scanTaskClient);
        }

        @Test
        @DisplayName("Should release the lease and retry when the schedule cannot be read")
        void shouldRetryWhenScheduleStoreDown() {
            // Given
            when(leaseManager.tryAcquire(eq(leaseKey), any())).thenReturn(Optional.of(token));
            when(scheduleStore.get(schedule.getId())).thenThrow(new IllegalStateException("pool exhausted"));

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            verify(leaseManager).release(leaseKey, token);
            assertThat(next.orElseThrow().getTriggerAt()).isEqualTo(NOW.plus(ScanJobRunner.STORE_RETRY_DELAY));
        }

        @Test
        @DisplayName("Should cancel the attempt and retry when the run start cannot be stored")
        void shouldAbandonWhenRunStartNotStored() {
            // Given
            givenLeaseAndSchedule();
            when(historyService.startExecution(eq(schedule), eq(FIRE_AT), anyMap())).thenReturn(execution);
            when(scheduleStore.markRunStart(schedule.getId(), NOW)).thenThrow(new IllegalStateException("down"));

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            verifyNoInteractions(scanTaskClient);
            assertThat(capturedOutcome().getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
            verify(leaseManager).release(leaseKey, token);
            verify(scheduleStore, never()).markRunResult(any(), any(), any());
            assertThat(next.orElseThrow().getFireAt()).isEqualTo(FIRE_AT);
            assertThat(next.get().getTriggerAt()).isEqualTo(NOW.plus(ScanJobRunner.STORE_RETRY_DELAY));
        }

        @Test
        @DisplayName("Should fail with TIMEOUT when the scan exceeds the soft timeout")
        void shouldFailOnSoftTimeout() {
            // Given
            properties.setTaskSoftTimeoutSeconds(1);
            givenLeaseAndSchedule();
            givenExecutionRecorded();
            var pending = new CompletableFuture<ScanTaskResult>();
            when(scanTaskClient.submit(any())).thenReturn(pending);

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            var outcome = capturedOutcome();
            assertThat(outcome.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(outcome.getErrorType()).isEqualTo(ExecutionOutcome.ERROR_TIMEOUT);
            assertThat(pending).isCancelled();
            verify(leaseManager).release(leaseKey, token);
            verify(scheduleStore).markRunResult(schedule.getId(), NOW, ExecutionStatus.FAILED);
            assertThat(next.orElseThrow().getFireAt()).isEqualTo(NEXT_DAY);
        }

        @Test
        @DisplayName("Should fail with LEASE_LOST and not release when renewal reports the lease lost")
        void shouldFailWhenLeaseLost() {
            // Given
            properties.setLeaseRenewIntervalSeconds(1);
            properties.setTaskSoftTimeoutSeconds(30);
            givenLeaseAndSchedule();
            givenExecutionRecorded();
            var pending = new CompletableFuture<ScanTaskResult>();
            when(scanTaskClient.submit(any())).thenReturn(pending);
            when(leaseManager.renew(eq(leaseKey), eq(token), any(Duration.class))).thenReturn(LeaseOutcome.LOST);

            // When
            runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            var outcome = capturedOutcome();
            assertThat(outcome.getErrorType()).isEqualTo(ExecutionOutcome.ERROR_LEASE_LOST);
            assertThat(pending).isCancelled();
            verify(leaseManager, never()).release(any(), any());
        }

        @Test
        @DisplayName("Should keep running when a renewal hits a store error")
        void shouldTolerateRenewError() {
            // Given
            properties.setLeaseRenewIntervalSeconds(1);
            givenLeaseAndSchedule();
            givenExecutionRecorded();
            var pending = new CompletableFuture<ScanTaskResult>();
            when(scanTaskClient.submit(any())).thenReturn(pending);
            when(leaseManager.renew(eq(leaseKey), eq(token), any(Duration.class))).thenAnswer(inv -> {
                pending.complete(ScanTaskResult.builder().scanId("scan-9").status("completed").build());
                throw new TransientInfrastructureException("blip", new RuntimeException());
            });

            // When
            runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            assertThat(capturedOutcome().getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
            verify(leaseManager).release(leaseKey, token);
        }

        @Test
        @DisplayName("Should compute the next run locally when the result cannot be stored")
        void shouldFallBackWhenResultNotStored() {
            // Given
            givenLeaseAndSchedule();
            when(historyService.startExecution(eq(schedule), eq(FIRE_AT), anyMap())).thenReturn(execution);
            when(scanTaskClient.submit(any())).thenReturn(CompletableFuture.completedFuture(
                    ScanTaskResult.builder().scanId("scan-1").status("completed").build()));
            when(scheduleStore.markRunResult(any(), any(), any())).thenThrow(new IllegalStateException("down"));

            // When
            var next = runner.run(ScheduledOccurrence.of(schedule, FIRE_AT));

            // Then
            assertThat(next.orElseThrow().getFireAt()).isEqualTo(NEXT_DAY);
        }
    }
}
