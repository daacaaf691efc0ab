package com.example.scanscheduler.client;

import com.example.scanscheduler.domain.enums.ScanType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Request/Response DTOs for the scan service
 */
public class ScanTaskModels {
    private ScanTaskModels() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScanTaskRequest {
        private UUID scheduleId;
        private UUID executionId;
        private String domain;
        private UUID domainConfigId;
        private UUID profileId;
        private ScanType scanType;
        private Map<String, Object> scanParams;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScanTaskResult {

        private static final Set<String> SUCCEEDED_STATUSES = Set.of("completed", "succeeded", "success");
        private static final Set<String> FAILED_STATUSES = Set.of("failed", "error", "cancelled");

        private String scanId;

        /**
         * Status reported by the scan service (queued, running, completed, failed, ...)
         */
        private String status;

        private String error;

        private Map<String, Object> details;

        /**
         * Whether the scan has finished, either way. An error message counts as finished.
         */
        public boolean isTerminal() {
            return error != null || hasStatusIn(SUCCEEDED_STATUSES) || hasStatusIn(FAILED_STATUSES);
        }

        public boolean isSuccess() {
            return error == null && hasStatusIn(SUCCEEDED_STATUSES);
        }

        private boolean hasStatusIn(Set<String> statuses) {
            return status != null && statuses.contains(status.toLowerCase());
        }
    }
}
