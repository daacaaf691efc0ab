package com.example.scanscheduler.service.watcher;

import com.example.scanscheduler.config.SchedulerMetrics;
import com.example.scanscheduler.domain.entity.ScanSchedule;
import com.example.scanscheduler.domain.enums.ScheduleFrequency;
import com.example.scanscheduler.service.schedule.ScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScheduleChangeWatcher Tests")
class ScheduleChangeWatcherTest {

    @Mock
    private ScheduleStore scheduleStore;

    @Mock
    private SchedulerMetrics metrics;

    private final ScheduleFingerprinter fingerprinter = new ScheduleFingerprinter();

    private ScheduleChangeWatcher watcher;

    private ScanSchedule daily;

    @BeforeEach
    void setUp() {
        watcher = new ScheduleChangeWatcher(scheduleStore, fingerprinter, metrics);
        daily = ScanSchedule.builder()
                .id(UUID.randomUUID())
                .domain("example.com")
                .frequency(ScheduleFrequency.DAILY)
                .timeConfig(Map.of("hour", 2, "minute", 0))
                .build();
    }

    @Test
    @DisplayName("Should report new schedules as added")
    void shouldReportAdded() {
        // Given
        when(scheduleStore.listEnabled()).thenReturn(List.of(daily));

        // When
        var delta = watcher.diff(Map.of());

        // Then
        assertThat(delta.getAdded()).containsExactly(daily);
        assertThat(delta.getFingerprints()).containsKey(daily.getId());
        verify(metrics).recordWatcherChanges(1, 0, 0);
    }

    @Test
    @DisplayName("Should report nothing for an unchanged schedule")
    void shouldReportNothingWhenUnchanged() {
        // Given
        when(scheduleStore.listEnabled()).thenReturn(List.of(daily));
        var known = Map.of(daily.getId(), fingerprinter.fingerprint(daily));

        // When
        var delta = watcher.diff(known);

        // Then
        assertThat(delta.isEmpty()).isTrue();
        assertThat(delta.isSkipped()).isFalse();
        verify(metrics, never()).recordWatcherChanges(anyInt(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("Should report a frequency change as updated")
    void shouldReportUpdated() {
        // Given
        var known = Map.of(daily.getId(), fingerprinter.fingerprint(daily));
        daily.setFrequency(ScheduleFrequency.HOURLY);
        when(scheduleStore.listEnabled()).thenReturn(List.of(daily));

        // When
        var delta = watcher.diff(known);

        // Then
        assertThat(delta.getUpdated()).containsExactly(daily);
        assertThat(delta.getFingerprints().get(daily.getId())).isNotEqualTo(known.get(daily.getId()));
    }

    @Test
    @DisplayName("Should report a schedule missing from the enabled set as removed")
    void shouldReportRemoved() {
        // Given
        var known = Map.of(daily.getId(), fingerprinter.fingerprint(daily));
        when(scheduleStore.listEnabled()).thenReturn(List.of());

        // When
        var delta = watcher.diff(known);

        // Then
        assertThat(delta.getRemoved()).containsExactly(daily.getId());
        verify(metrics).recordWatcherChanges(0, 0, 1);
    }

    @Test
    @DisplayName("Should skip the cycle when the store fails")
    void shouldSkipCycleOnStoreFailure() {
        // Given
        var known = Map.of(daily.getId(), fingerprinter.fingerprint(daily));
        when(scheduleStore.listEnabled()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When
        var delta = watcher.diff(known);

        // Then
        assertThat(delta.isSkipped()).isTrue();
        assertThat(delta.getRemoved()).isEmpty();
        verify(metrics).recordWatcherError();
    }
}
