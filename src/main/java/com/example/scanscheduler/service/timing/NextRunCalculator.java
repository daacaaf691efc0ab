package com.example.scanscheduler.service.timing;

import com.cronutils.model.time.ExecutionTime;
import com.example.scanscheduler.config.ScanSchedulerProperties;
import com.example.scanscheduler.domain.entity.ScanSchedule;
import com.example.scanscheduler.domain.enums.ScheduleFrequency;
import com.example.scanscheduler.exception.InvalidScheduleDefinitionException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Map;

/**
 * Computes the next due instant of a schedule.
 * <p>
 * Wall-clock fields are interpreted in the configured scheduler time zone.
 * The result is always strictly after the reference instant, so calling it
 * with a fire time never yields that same fire time again.
 */
@Component
public class NextRunCalculator {

    private final ZoneId zone;

    @Autowired
    public NextRunCalculator(ScanSchedulerProperties properties) {
        this(properties.zoneId());
    }

    public NextRunCalculator(ZoneId zone) {
        this.zone = zone;
    }

    public Instant nextRun(ScanSchedule schedule, Instant after) {
        return nextRun(schedule.getFrequency(), schedule.getTimeConfig(), after);
    }

    /**
     * @throws InvalidScheduleDefinitionException if the time config does not fit the frequency
     */
    public Instant nextRun(ScheduleFrequency frequency, Map<String, Object> timeConfig, Instant after) {
        return nextRun(TimeSpecParser.parse(frequency, timeConfig), after);
    }

    public Instant nextRun(TimeSpec spec, Instant after) {
        var base = after.atZone(zone);
        ZonedDateTime candidate;

        switch (spec.getFrequency()) {
            case HOURLY:
                candidate = base.truncatedTo(ChronoUnit.HOURS).withMinute(spec.getMinute());
                if (!candidate.toInstant().isAfter(after)) {
                    candidate = candidate.plusHours(1);
                }
                break;
            case DAILY:
                candidate = atTime(base, spec);
                if (!candidate.toInstant().isAfter(after)) {
                    candidate = atTime(base.plusDays(1), spec);
                }
                break;
            case WEEKLY:
                candidate = atTime(base.with(TemporalAdjusters.nextOrSame(spec.getDayOfWeek())), spec);
                if (!candidate.toInstant().isAfter(after)) {
                    candidate = atTime(base.with(TemporalAdjusters.next(spec.getDayOfWeek())), spec);
                }
                break;
            case MONTHLY:
                candidate = inMonth(base, spec);
                if (!candidate.toInstant().isAfter(after)) {
                    candidate = inMonth(base.withDayOfMonth(1).plusMonths(1), spec);
                }
                break;
            case CUSTOM:
                var executionTime = ExecutionTime.forCron(TimeSpecParser.parseCron(spec.getCron()));
                candidate = executionTime.nextExecution(base)
                        .orElseThrow(() -> new InvalidScheduleDefinitionException("cron",
                                "expression '" + spec.getCron() + "' has no future run time"));
                break;
            default:
                throw new InvalidScheduleDefinitionException("frequency", "unsupported frequency " + spec.getFrequency());
        }
        return candidate.toInstant();
    }

    private ZonedDateTime atTime(ZonedDateTime day, TimeSpec spec) {
        return ZonedDateTime.of(day.toLocalDate(), LocalTime.of(spec.getHour(), spec.getMinute()), zone);
    }

    private ZonedDateTime inMonth(ZonedDateTime month, TimeSpec spec) {
        var date = month.toLocalDate();
        var day = Math.min(spec.getDayOfMonth(), date.lengthOfMonth());
        return ZonedDateTime.of(date.withDayOfMonth(day), LocalTime.of(spec.getHour(), spec.getMinute()), zone);
    }
}
