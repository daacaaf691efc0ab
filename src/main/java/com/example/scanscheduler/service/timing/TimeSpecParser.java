package com.example.scanscheduler.service.timing;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import com.example.scanscheduler.domain.enums.ScheduleFrequency;
import com.example.scanscheduler.exception.InvalidScheduleDefinitionException;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the JSON time config stored with a schedule into a {@link TimeSpec}.
 * <p>
 * Accepted shapes:
 * <pre>
 * HOURLY  {"minute": 15}
 * DAILY   {"hour": 2, "minute": 0}
 * WEEKLY  {"day_of_week": "monday" | "mon" | 0..6 (0 = Monday), "hour": 2, "minute": 0}
 * MONTHLY {"day_of_month": 1..31, "hour": 2, "minute": 0}
 * CUSTOM  {"cron": "0 2 * * 1-5"}
 * </pre>
 * Missing hour and minute default to 0, a missing weekday to Monday and a
 * missing day of month to 1. {@code day} is accepted in place of
 * {@code day_of_week} and {@code day_of_month}.
 */
public final class TimeSpecParser {

    private static final CronParser CRON_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private TimeSpecParser() {
    }

    public static TimeSpec parse(ScheduleFrequency frequency, Map<String, Object> timeConfig) {
        if (frequency == null) {
            throw new InvalidScheduleDefinitionException("frequency", "frequency is required");
        }
        var config = timeConfig != null ? timeConfig : Map.<String, Object>of();
        var builder = TimeSpec.builder().frequency(frequency);

        switch (frequency) {
            case HOURLY:
                return builder.minute(readInt(config, "minute", 0, 0, 59)).build();
            case DAILY:
                return builder
                        .hour(readInt(config, "hour", 0, 0, 23))
                        .minute(readInt(config, "minute", 0, 0, 59))
                        .build();
            case WEEKLY:
                return builder
                        .dayOfWeek(readDayOfWeek(config))
                        .hour(readInt(config, "hour", 0, 0, 23))
                        .minute(readInt(config, "minute", 0, 0, 59))
                        .build();
            case MONTHLY:
                var dayKey = config.containsKey("day_of_month") ? "day_of_month" : "day";
                return builder
                        .dayOfMonth(readInt(config, dayKey, 1, 1, 31))
                        .hour(readInt(config, "hour", 0, 0, 23))
                        .minute(readInt(config, "minute", 0, 0, 59))
                        .build();
            case CUSTOM:
                return builder.cron(parseCron(config.get("cron")).asString()).build();
            default:
                throw new InvalidScheduleDefinitionException("frequency", "unsupported frequency " + frequency);
        }
    }

    /**
     * Parse and validate a five-field Unix cron expression
     */
    public static Cron parseCron(Object value) {
        if (!(value instanceof String expression) || expression.isBlank()) {
            throw new InvalidScheduleDefinitionException("cron", "a cron expression is required for custom schedules");
        }
        try {
            return CRON_PARSER.parse(expression.trim()).validate();
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleDefinitionException("cron", e.getMessage(), e);
        }
    }

    private static DayOfWeek readDayOfWeek(Map<String, Object> config) {
        var key = config.containsKey("day_of_week") ? "day_of_week" : "day";
        var value = config.get(key);
        if (value == null) {
            return DayOfWeek.MONDAY;
        }
        if (value instanceof String text && !isInteger(text.trim())) {
            var name = text.trim().toLowerCase(Locale.ROOT);
            for (var day : DayOfWeek.values()) {
                var full = day.name().toLowerCase(Locale.ROOT);
                if (full.equals(name) || full.substring(0, 3).equals(name)) {
                    return day;
                }
            }
            throw new InvalidScheduleDefinitionException(key, "unknown weekday '" + text + "'");
        }
        // 0 = Monday ... 6 = Sunday
        return DayOfWeek.of(readInt(config, key, 0, 0, 6) + 1);
    }

    private static int readInt(Map<String, Object> config, String key, int defaultValue, int min, int max) {
        var value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        int result;
        if (value instanceof Number number) {
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                throw new InvalidScheduleDefinitionException(key, "must be a whole number, got " + value);
            }
            result = number.intValue();
        } else if (value instanceof String text && isInteger(text.trim())) {
            result = Integer.parseInt(text.trim());
        } else {
            throw new InvalidScheduleDefinitionException(key, "must be a number, got " + value);
        }
        if (result < min || result > max) {
            throw new InvalidScheduleDefinitionException(key, String.format("must be between %d and %d, got %d", min, max, result));
        }
        return result;
    }

    private static boolean isInteger(String text) {
        return !text.isEmpty() && text.length() < 10 && text.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}
