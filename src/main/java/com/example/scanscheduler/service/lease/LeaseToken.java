package com.example.scanscheduler.service.lease;

import lombok.Value;

import java.time.Instant;

/**
 * Proof of lease ownership, required to renew or release
 */
@Value
public class LeaseToken {

    String key;

    /**
     * Opaque owner token, {@code <instanceId>:<uuid>}
     */
    String token;

    Instant expiresAt;

    public LeaseToken withExpiresAt(Instant newExpiresAt) {
        return new LeaseToken(key, token, newExpiresAt);
    }
}
