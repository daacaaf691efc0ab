package com.example.scanscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Exclusive, expiring ownership record for one schedule.
 * Written only through the atomic statements in ScheduleLeaseRepository.
 */
@Entity
@Table(name = "schedule_leases")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleLease {

    @Id
    @Column(name = "lease_key", nullable = false, length = 200)
    private String leaseKey;

    @Column(name = "owner_token", nullable = false, length = 200)
    private String ownerToken;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public boolean isHeldAt(Instant now) {
        return expiresAt != null && expiresAt.isAfter(now);
    }
}
