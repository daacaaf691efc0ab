package com.example.scanscheduler.service.lease;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Cluster-wide mutual exclusion per key with automatic expiry.
 * <p>
 * Implementations never block waiting for a busy lease. Store failures are
 * reported as {@link com.example.scanscheduler.exception.TransientInfrastructureException};
 * contention is a normal result, never an exception.
 */
public interface LeaseManager {

    /**
     * Take the lease if it is free or expired
     *
     * @return the token, or empty if another owner holds an unexpired lease
     */
    Optional<LeaseToken> tryAcquire(String key, Duration ttl);

    /**
     * Extend a held lease to now + ttl
     */
    LeaseOutcome renew(String key, LeaseToken token, Duration ttl);

    LeaseOutcome release(String key, LeaseToken token);

    static String scheduleKey(UUID scheduleId) {
        return "schedule:" + scheduleId;
    }
}
