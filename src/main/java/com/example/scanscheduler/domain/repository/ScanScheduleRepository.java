package com.example.scanscheduler.domain.repository;

import com.example.scanscheduler.domain.entity.ScanSchedule;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ScanSchedule entity.
 * <p>
 * Mutations that recompute {@code next_run} go through
 * {@link #findByIdForUpdate(UUID)} so the definition is read and written
 * under one row lock.
 */
@Repository
public interface ScanScheduleRepository extends JpaRepository<ScanSchedule, UUID> {

    List<ScanSchedule> findByEnabledTrueOrderByDomainAscCreatedAtAsc();

    List<ScanSchedule> findAllByOrderByDomainAscCreatedAtAsc();

    List<ScanSchedule> findByDomainOrderByCreatedAtAsc(String domain);

    /**
     * Load a schedule holding a row-level write lock until the transaction ends
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ScanSchedule s WHERE s.id = :id")
    Optional<ScanSchedule> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Record that a run has been started
     *
     * @return number of rows updated (0 if the schedule no longer exists)
     */
    @Modifying
    @Query("""
            UPDATE ScanSchedule s
            SET s.lastRunStartedAt = :startedAt,
                s.updatedAt = :now
            WHERE s.id = :id
            """)
    int markRunStart(@Param("id") UUID id, @Param("startedAt") Instant startedAt, @Param("now") Instant now);

    long countByEnabledTrue();
}
