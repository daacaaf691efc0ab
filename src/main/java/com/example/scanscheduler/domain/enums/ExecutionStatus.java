package com.example.scanscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of a single scan job execution.
 * <p>
 * An execution is created as STARTED and moves exactly once to one of the
 * terminal statuses. It never moves backward.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionStatus {

    /**
     * Lease won and the scan task has been invoked.
     */
    STARTED("started", false),

    /**
     * Scan task returned a successful result.
     */
    SUCCESS("success", true),

    /**
     * Scan task failed, timed out, lost its lease or was orphaned.
     */
    FAILED("failed", true),

    /**
     * Execution was abandoned without running the task.
     */
    CANCELLED("cancelled", true);

    private final String code;
    private final boolean terminal;

    public static ExecutionStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status code: " + code);
    }

    /**
     * Check whether moving from this status to {@code target} is allowed
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return this == STARTED && target != null && target.isTerminal();
    }
}
