package com.example.scanscheduler.domain.entity;

import com.example.scanscheduler.domain.enums.ExecutionStatus;
import com.example.scanscheduler.domain.enums.ScanType;
import com.example.scanscheduler.domain.enums.ScheduleFrequency;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Persisted scan schedule definition.
 * <p>
 * Definition fields (domain, frequency, time config, scan settings, enabled)
 * are owned by the management boundary. Run bookkeeping (next/last run,
 * last status) is written by the scheduler. {@code nextRun} is always
 * computed server-side from frequency and time config.
 */
@Entity
@Table(name = "scan_schedules", indexes = {
        @Index(name = "idx_schedule_enabled", columnList = "enabled"),
        @Index(name = "idx_schedule_domain", columnList = "domain"),
        @Index(name = "idx_schedule_next_run", columnList = "next_run")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScanSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Domain to scan
     */
    @Column(name = "domain", nullable = false, length = 255)
    private String domain;

    /**
     * Management-side domain configuration this schedule belongs to
     */
    @Column(name = "domain_config_id")
    private UUID domainConfigId;

    /**
     * Optional scan profile reference
     */
    @Column(name = "profile_id")
    private UUID profileId;

    @Enumerated(EnumType.STRING)
    @Column(name = "frequency", nullable = false, length = 20)
    private ScheduleFrequency frequency;

    /**
     * Time specification, shape depends on frequency
     * (e.g. {"hour": 2, "minute": 0} for DAILY, {"cron": "..."} for CUSTOM)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "time_config", columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private Map<String, Object> timeConfig = new HashMap<>();

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "scan_type", nullable = false, length = 20)
    @Builder.Default
    private ScanType scanType = ScanType.QUICK;

    /**
     * Opaque scan configuration handed to the scan service
     * (max_pages, custom_pages, accept_selector, ...)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "scan_params", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> scanParams = new HashMap<>();

    @Column(name = "description", length = 500)
    private String description;

    // === Run Bookkeeping ===

    @Column(name = "next_run")
    private Instant nextRun;

    /**
     * When the last run finished
     */
    @Column(name = "last_run")
    private Instant lastRun;

    /**
     * When the last run was started; used to detect an occurrence that
     * another instance already handled
     */
    @Column(name = "last_run_started_at")
    private Instant lastRunStartedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_status", length = 20)
    private ExecutionStatus lastStatus;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.timeConfig == null) {
            this.timeConfig = new HashMap<>();
        }
        if (this.scanParams == null) {
            this.scanParams = new HashMap<>();
        }
        if (this.scanType == null) {
            this.scanType = ScanType.QUICK;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    /**
     * Whether the occurrence due at {@code fireAt} has already been started
     * by some instance
     */
    public boolean hasStartedOccurrence(Instant fireAt) {
        return lastRunStartedAt != null && fireAt != null && !lastRunStartedAt.isBefore(fireAt);
    }

    /**
     * Stable job identifier used in execution history
     */
    public String getJobId() {
        return "scan-schedule:" + id;
    }
}
