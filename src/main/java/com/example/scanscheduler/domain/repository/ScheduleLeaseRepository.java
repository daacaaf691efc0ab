package com.example.scanscheduler.domain.repository;

import com.example.scanscheduler.domain.entity.ScheduleLease;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Repository for schedule leases.
 * <p>
 * Every method is a single conditional statement, so concurrent callers
 * on different instances cannot both win.
 */
@Repository
public interface ScheduleLeaseRepository extends JpaRepository<ScheduleLease, String> {

    /**
     * Set the lease if it is absent or expired.
     * Uses PostgreSQL's INSERT ... ON CONFLICT with a conditional DO UPDATE.
     *
     * @return 1 if the lease is now owned by {@code token}, 0 if someone else holds it
     */
    @Modifying
    @Query(value = """
            INSERT INTO schedule_leases (lease_key, owner_token, acquired_at, expires_at)
            VALUES (:leaseKey, :token, :now, :expiresAt)
            ON CONFLICT (lease_key) DO UPDATE
              SET owner_token = EXCLUDED.owner_token,
                  acquired_at = EXCLUDED.acquired_at,
                  expires_at = EXCLUDED.expires_at
              WHERE schedule_leases.expires_at <= EXCLUDED.acquired_at
            """, nativeQuery = true)
    int tryAcquire(
            @Param("leaseKey") String leaseKey,
            @Param("token") String token,
            @Param("now") Instant now,
            @Param("expiresAt") Instant expiresAt);

    /**
     * Push the expiry forward, only for the current owner
     *
     * @return 1 if renewed, 0 if the token no longer owns the lease
     */
    @Modifying
    @Query("""
            UPDATE ScheduleLease l
            SET l.expiresAt = :expiresAt
            WHERE l.leaseKey = :leaseKey
              AND l.ownerToken = :token
            """)
    int renew(@Param("leaseKey") String leaseKey, @Param("token") String token, @Param("expiresAt") Instant expiresAt);

    /**
     * Delete the lease, only for the current owner
     *
     * @return 1 if released, 0 if the token no longer owns the lease
     */
    @Modifying
    @Query("""
            DELETE FROM ScheduleLease l
            WHERE l.leaseKey = :leaseKey
              AND l.ownerToken = :token
            """)
    int release(@Param("leaseKey") String leaseKey, @Param("token") String token);

    /**
     * Remove leases that expired long ago and were never re-acquired
     */
    @Transactional
    @Modifying
    @Query("""
            DELETE FROM ScheduleLease l
            WHERE l.expiresAt < :cutoff
            """)
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
