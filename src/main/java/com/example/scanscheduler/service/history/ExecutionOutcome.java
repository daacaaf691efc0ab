package com.example.scanscheduler.service.history;

import com.example.scanscheduler.domain.enums.ExecutionStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Terminal result of an execution.
 * <p>
 * Contains everything needed to complete the execution record.
 */
@Data
@Builder
public class ExecutionOutcome {

    public static final String ERROR_TIMEOUT = "TIMEOUT";
    public static final String ERROR_LEASE_LOST = "LEASE_LOST";
    public static final String ERROR_TASK_FAILED = "TASK_FAILED";
    public static final String ERROR_ORPHANED = "ORPHANED";

    private ExecutionStatus status;

    /**
     * Scan created by the scan service
     */
    private String scanId;

    private String errorMessage;

    /**
     * Error classification for analysis (TIMEOUT, LEASE_LOST, exception name, ...)
     */
    private String errorType;

    private String stackTrace;

    /**
     * Structured details reported by the scan service
     */
    @Builder.Default
    private Map<String, Object> details = new HashMap<>();

    /**
     * When the execution ended; the recorder uses its clock when null
     */
    private Instant completedAt;

    public static ExecutionOutcome success(String scanId) {
        return ExecutionOutcome.builder()
                .status(ExecutionStatus.SUCCESS)
                .scanId(scanId)
                .build();
    }

    public static ExecutionOutcome failure(String errorType, String errorMessage) {
        return ExecutionOutcome.builder()
                .status(ExecutionStatus.FAILED)
                .errorType(errorType)
                .errorMessage(errorMessage)
                .build();
    }

    /**
     * Failure reported by the scan service itself
     */
    public static ExecutionOutcome taskFailure(String scanId, String errorMessage, Map<String, Object> details) {
        return ExecutionOutcome.builder()
                .status(ExecutionStatus.FAILED)
                .scanId(scanId)
                .errorType(ERROR_TASK_FAILED)
                .errorMessage(errorMessage)
                .details(details != null ? details : new HashMap<>())
                .build();
    }

    public static ExecutionOutcome failure(Throwable e) {
        return ExecutionOutcome.builder()
                .status(ExecutionStatus.FAILED)
                .errorType(e.getClass().getSimpleName())
                .errorMessage(e.getMessage())
                .stackTrace(truncateStackTrace(e))
                .build();
    }

    public static ExecutionOutcome cancelled(String reason) {
        return ExecutionOutcome.builder()
                .status(ExecutionStatus.CANCELLED)
                .errorMessage(reason)
                .build();
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    /**
     * Truncate stack trace to prevent database overflow
     */
    static String truncateStackTrace(Throwable e) {
        if (e == null) return null;

        var sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");

        var trace = e.getStackTrace();
        var maxLines = Math.min(trace.length, 20);
        for (var i = 0; i < maxLines; i++) {
            sb.append("\tat ").append(trace[i]).append("\n");
        }
        if (trace.length > maxLines) {
            sb.append("\t... ").append(trace.length - maxLines).append(" more\n");
        }

        var result = sb.toString();
        if (result.length() > 4000) {
            result = result.substring(0, 4000) + "...";
        }
        return result;
    }
}
