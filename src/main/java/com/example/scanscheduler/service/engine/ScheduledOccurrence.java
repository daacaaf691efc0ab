package com.example.scanscheduler.service.engine;

import com.example.scanscheduler.domain.entity.ScanSchedule;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One concrete due instant of a schedule, as held by the engine.
 * <p>
 * {@code fireAt} identifies the occurrence and is what the
 * already-started check compares against. {@code triggerAt} is when the
 * timer goes off; it only differs from {@code fireAt} when an attempt is
 * retried after a store failure.
 */
@Value
public class ScheduledOccurrence {

    UUID scheduleId;

    Instant fireAt;

    Instant triggerAt;

    /**
     * Schedule state the occurrence was derived from
     */
    ScanSchedule schedule;

    public static ScheduledOccurrence of(ScanSchedule schedule, Instant fireAt) {
        return new ScheduledOccurrence(schedule.getId(), fireAt, fireAt, schedule);
    }

    /**
     * Same occurrence, triggered again at {@code retryAt}
     */
    public ScheduledOccurrence retryAt(Instant retryAt) {
        return new ScheduledOccurrence(scheduleId, fireAt, retryAt, schedule);
    }
}
