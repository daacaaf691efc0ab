package com.example.scanscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregate execution statistics over a trailing window of days.
 * Duration fields are null when no execution in the window has finished.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionStatistics {

    private long total;
    private long successful;
    private long failed;
    private long cancelled;

    /**
     * successful / total * 100, 0 when there are no executions
     */
    private double successRate;

    private Double avgDurationMs;
    private Long minDurationMs;
    private Long maxDurationMs;
    private int periodDays;
    private Instant generatedAt;
}
