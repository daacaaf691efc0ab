package com.example.scanscheduler.domain.repository;

/**
 * Aggregate row over job executions in a time window.
 * Averages and extremes are null when no execution has a duration.
 */
public interface ExecutionAggregate {

    Number getTotal();

    Number getSuccessful();

    Number getFailed();

    Number getCancelled();

    Number getAvgDurationMs();

    Number getMinDurationMs();

    Number getMaxDurationMs();
}
