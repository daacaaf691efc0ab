package com.example.scanscheduler.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for the scan scheduler.
 * Loaded from application.yml, unknown keys are rejected.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "scan-scheduler", ignoreUnknownFields = false)
public class ScanSchedulerProperties {

    /**
     * Identifier of this scheduler instance, used in lease tokens and
     * execution records. Derived from the host name when blank.
     */
    private String instanceId;

    /**
     * Zone in which schedule wall-clock times (hour, minute, day) are interpreted
     */
    @NotBlank
    private String timeZone = "UTC";

    /**
     * Lease time-to-live. Must exceed the soft task timeout.
     */
    @Min(10)
    private long leaseTtlSeconds = 1800;

    /**
     * How often a running execution renews its lease
     */
    @Min(1)
    private long leaseRenewIntervalSeconds = 300;

    /**
     * Change watcher polling interval in milliseconds.
     * Upper bound on how long a schedule edit takes to reach the engine.
     */
    @Min(1000)
    private long watcherIntervalMs = 60000;

    /**
     * Maximum scan executions running at the same time on this instance
     */
    @Min(1)
    private int maxConcurrentExecutions = 5;

    /**
     * Soft timeout for a single scan task
     */
    @Min(1)
    private long taskSoftTimeoutSeconds = 1200;

    /**
     * How long shutdown waits for in-flight executions
     */
    @Min(0)
    private long shutdownGracePeriodSeconds = 30;

    /**
     * Initial delay before retrying a failed startup load
     */
    @Min(1)
    private long startupBackoffInitialMs = 1000;

    /**
     * Upper bound for the startup retry delay
     */
    @Min(1)
    private long startupBackoffMaxMs = 60000;

    /**
     * Record a CANCELLED execution when an occurrence is skipped because
     * another instance holds the lease
     */
    private boolean recordContentionSkips = false;

    /**
     * Days of execution history to keep
     */
    @Min(1)
    private int historyRetentionDays = 90;

    /**
     * Age in minutes after which a STARTED execution is considered orphaned
     */
    @Min(1)
    private int orphanedExecutionThresholdMinutes = 120;

    /**
     * Interval of the history maintenance jobs in milliseconds
     */
    @Min(1000)
    private long maintenanceIntervalMs = 3600000;

    /**
     * Refresh interval of the schedule count gauge in milliseconds
     */
    @Min(1000)
    private long metricsUpdateIntervalMs = 60000;

    @AssertTrue(message = "lease-ttl-seconds must be greater than task-soft-timeout-seconds")
    public boolean isLeaseTtlAboveTaskTimeout() {
        return leaseTtlSeconds > taskSoftTimeoutSeconds;
    }

    @AssertTrue(message = "lease-renew-interval-seconds must be less than lease-ttl-seconds")
    public boolean isRenewIntervalBelowLeaseTtl() {
        return leaseRenewIntervalSeconds < leaseTtlSeconds;
    }

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    public Duration leaseTtl() {
        return Duration.ofSeconds(leaseTtlSeconds);
    }

    public Duration leaseRenewInterval() {
        return Duration.ofSeconds(leaseRenewIntervalSeconds);
    }

    public Duration taskSoftTimeout() {
        return Duration.ofSeconds(taskSoftTimeoutSeconds);
    }
}
