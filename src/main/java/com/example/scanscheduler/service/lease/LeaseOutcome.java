package com.example.scanscheduler.service.lease;

/**
 * Result of renewing or releasing a lease
 */
public enum LeaseOutcome {

    OK,

    /**
     * The presented token no longer owns the lease: it expired and was
     * taken by another owner, or was already released.
     */
    LOST
}
