package com.example.scanscheduler.domain.entity;

import com.example.scanscheduler.domain.enums.ExecutionStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One attempt to run a scheduled scan.
 * Created as STARTED when a lease is won, completed exactly once.
 */
@Entity
@Table(name = "job_executions", indexes = {
        @Index(name = "idx_job_exec_schedule_started", columnList = "schedule_id, started_at"),
        @Index(name = "idx_job_exec_domain_started", columnList = "domain, started_at"),
        @Index(name = "idx_job_exec_status", columnList = "status"),
        @Index(name = "idx_job_exec_started_at", columnList = "started_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Schedule that fired; null once the schedule has been deleted
     */
    @Column(name = "schedule_id")
    private UUID scheduleId;

    @Column(name = "job_id", nullable = false, length = 255)
    private String jobId;

    @Column(name = "domain", nullable = false, length = 255)
    private String domain;

    @Column(name = "domain_config_id")
    private UUID domainConfigId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ExecutionStatus status;

    /**
     * Due instant of the occurrence that triggered this execution
     */
    @Column(name = "occurrence_at")
    private Instant occurrenceAt;

    @Column(name = "executor_instance", length = 100)
    private String executorInstance;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    /**
     * Scan created by the scan service, if any
     */
    @Column(name = "scan_id", length = 100)
    private String scanId;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "error_type", length = 100)
    private String errorType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error_details", columnDefinition = "jsonb")
    private Map<String, Object> errorDetails;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        if (this.metadata == null) {
            this.metadata = new HashMap<>();
        }
    }

    /**
     * Calculate duration if not set
     */
    public void calculateDuration() {
        if (startedAt != null && completedAt != null) {
            this.durationMs = completedAt.toEpochMilli() - startedAt.toEpochMilli();
        }
    }
}
