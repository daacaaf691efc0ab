package com.example.scanscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How often a schedule fires. Each frequency implies the shape of the
 * time configuration it is stored with.
 */
@Getter
@RequiredArgsConstructor
public enum ScheduleFrequency {

    /**
     * Every hour at {@code minute}
     */
    HOURLY("hourly", "Hourly"),

    /**
     * Every day at {@code hour:minute}
     */
    DAILY("daily", "Daily"),

    /**
     * Every week on {@code day_of_week} at {@code hour:minute}
     */
    WEEKLY("weekly", "Weekly"),

    /**
     * Every month on {@code day_of_month} at {@code hour:minute}
     */
    MONTHLY("monthly", "Monthly"),

    /**
     * Five-field Unix cron expression in {@code cron}
     */
    CUSTOM("custom", "Custom");

    private final String code;
    private final String displayName;

    /**
     * Find ScheduleFrequency by its code value (case-insensitive)
     */
    public static ScheduleFrequency fromCode(String code) {
        for (var frequency : values()) {
            if (frequency.getCode().equalsIgnoreCase(code)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unknown schedule frequency code: " + code);
    }
}
