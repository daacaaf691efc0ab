package com.example.scanscheduler.service.lease;

import com.example.scanscheduler.config.InstanceIdentity;
import com.example.scanscheduler.domain.repository.ScheduleLeaseRepository;
import com.example.scanscheduler.exception.TransientInfrastructureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Lease manager backed by the {@code schedule_leases} table.
 * <p>
 * Acquire is one INSERT ... ON CONFLICT DO UPDATE statement that only
 * overwrites an expired row, so two instances racing for the same key can
 * never both succeed. Renew and release match on the owner token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseLeaseManager implements LeaseManager {

    private final ScheduleLeaseRepository leaseRepository;
    private final InstanceIdentity instanceIdentity;
    private final Clock clock;

    @Override
    @Transactional
    public Optional<LeaseToken> tryAcquire(String key, Duration ttl) {
        var now = clock.instant();
        var expiresAt = now.plus(ttl);
        var token = instanceIdentity.getId() + ":" + UUID.randomUUID();

        try {
            var updated = leaseRepository.tryAcquire(key, token, now, expiresAt);
            if (updated == 0) {
                log.debug("Lease {} is held by another owner", key);
                return Optional.empty();
            }
            log.debug("Acquired lease {} until {}", key, expiresAt);
            return Optional.of(new LeaseToken(key, token, expiresAt));
        } catch (DataAccessException e) {
            throw new TransientInfrastructureException("Failed to acquire lease " + key, e);
        }
    }

    @Override
    @Transactional
    public LeaseOutcome renew(String key, LeaseToken token, Duration ttl) {
        var expiresAt = clock.instant().plus(ttl);
        try {
            var updated = leaseRepository.renew(key, token.getToken(), expiresAt);
            if (updated == 0) {
                log.warn("Lease {} lost before renewal (token {})", key, token.getToken());
                return LeaseOutcome.LOST;
            }
            log.debug("Renewed lease {} until {}", key, expiresAt);
            return LeaseOutcome.OK;
        } catch (DataAccessException e) {
            throw new TransientInfrastructureException("Failed to renew lease " + key, e);
        }
    }

    @Override
    @Transactional
    public LeaseOutcome release(String key, LeaseToken token) {
        try {
            var deleted = leaseRepository.release(key, token.getToken());
            if (deleted == 0) {
                log.info("Lease {} was no longer held by token {} at release", key, token.getToken());
                return LeaseOutcome.LOST;
            }
            log.debug("Released lease {}", key);
            return LeaseOutcome.OK;
        } catch (DataAccessException e) {
            throw new TransientInfrastructureException("Failed to release lease " + key, e);
        }
    }
}
