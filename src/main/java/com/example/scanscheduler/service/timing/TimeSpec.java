package com.example.scanscheduler.service.timing;

import com.example.scanscheduler.domain.enums.ScheduleFrequency;
import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;

/**
 * Parsed, validated time specification of a schedule.
 * Only the fields relevant to the frequency are set.
 */
@Value
@Builder
public class TimeSpec {

    ScheduleFrequency frequency;

    int minute;

    int hour;

    /**
     * WEEKLY only
     */
    DayOfWeek dayOfWeek;

    /**
     * MONTHLY only, 1-31. Clamped to the length of shorter months.
     */
    int dayOfMonth;

    /**
     * CUSTOM only, five-field Unix cron expression
     */
    String cron;
}
