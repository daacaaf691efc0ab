package com.example.scanscheduler.domain.repository;

import com.example.scanscheduler.domain.entity.JobExecution;
import com.example.scanscheduler.domain.enums.ExecutionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for JobExecution entity
 */
@Repository
public interface JobExecutionRepository extends JpaRepository<JobExecution, UUID> {

    List<JobExecution> findByScheduleIdOrderByStartedAtDesc(UUID scheduleId, Pageable pageable);

    List<JobExecution> findByDomainOrderByStartedAtDesc(String domain, Pageable pageable);

    List<JobExecution> findByStartedAtGreaterThanEqualOrderByStartedAtDesc(Instant since);

    List<JobExecution> findByStartedAtGreaterThanEqualAndStatusOrderByStartedAtDesc(Instant since, ExecutionStatus status);

    /**
     * Load an execution holding a row-level write lock, used to complete it exactly once
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM JobExecution e WHERE e.id = :id")
    Optional<JobExecution> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Executions still STARTED long after any lease could have been held.
     * Their owning instance is presumed dead.
     */
    @Query("""
            SELECT e FROM JobExecution e
            WHERE e.status = 'STARTED'
              AND e.startedAt < :threshold
            """)
    List<JobExecution> findStaleStarted(@Param("threshold") Instant threshold);

    /**
     * Keep history when a schedule is deleted
     */
    @Modifying
    @Query("""
            UPDATE JobExecution e
            SET e.scheduleId = NULL
            WHERE e.scheduleId = :scheduleId
            """)
    int detachSchedule(@Param("scheduleId") UUID scheduleId);

    @Query("""
            SELECT COUNT(e) AS total,
                   SUM(CASE WHEN e.status = 'SUCCESS' THEN 1 ELSE 0 END) AS successful,
                   SUM(CASE WHEN e.status = 'FAILED' THEN 1 ELSE 0 END) AS failed,
                   SUM(CASE WHEN e.status = 'CANCELLED' THEN 1 ELSE 0 END) AS cancelled,
                   AVG(e.durationMs) AS avgDurationMs,
                   MIN(e.durationMs) AS minDurationMs,
                   MAX(e.durationMs) AS maxDurationMs
            FROM JobExecution e
            WHERE e.startedAt >= :since
            """)
    ExecutionAggregate aggregateSince(@Param("since") Instant since);

    @Query("""
            SELECT COUNT(e) AS total,
                   SUM(CASE WHEN e.status = 'SUCCESS' THEN 1 ELSE 0 END) AS successful,
                   SUM(CASE WHEN e.status = 'FAILED' THEN 1 ELSE 0 END) AS failed,
                   SUM(CASE WHEN e.status = 'CANCELLED' THEN 1 ELSE 0 END) AS cancelled,
                   AVG(e.durationMs) AS avgDurationMs,
                   MIN(e.durationMs) AS minDurationMs,
                   MAX(e.durationMs) AS maxDurationMs
            FROM JobExecution e
            WHERE e.startedAt >= :since
              AND e.scheduleId = :scheduleId
            """)
    ExecutionAggregate aggregateForSchedule(@Param("since") Instant since, @Param("scheduleId") UUID scheduleId);

    @Query("""
            SELECT COUNT(e) AS total,
                   SUM(CASE WHEN e.status = 'SUCCESS' THEN 1 ELSE 0 END) AS successful,
                   SUM(CASE WHEN e.status = 'FAILED' THEN 1 ELSE 0 END) AS failed,
                   SUM(CASE WHEN e.status = 'CANCELLED' THEN 1 ELSE 0 END) AS cancelled,
                   AVG(e.durationMs) AS avgDurationMs,
                   MIN(e.durationMs) AS minDurationMs,
                   MAX(e.durationMs) AS maxDurationMs
            FROM JobExecution e
            WHERE e.startedAt >= :since
              AND e.domain = :domain
            """)
    ExecutionAggregate aggregateForDomain(@Param("since") Instant since, @Param("domain") String domain);

    /**
     * Delete old execution records (retention cleanup)
     */
    @Transactional
    @Modifying
    @Query("""
            DELETE FROM JobExecution e
            WHERE e.startedAt < :cutoff
              AND e.status <> 'STARTED'
            """)
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
