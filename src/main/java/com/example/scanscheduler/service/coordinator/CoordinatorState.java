package com.example.scanscheduler.service.coordinator;

/**
 * Lifecycle of the scheduler coordinator.
 * <p>
 * STOPPED → STARTING → RUNNING → STOPPING → STOPPED. A coordinator stays
 * in STARTING while the initial schedule load keeps failing.
 */
public enum CoordinatorState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}
