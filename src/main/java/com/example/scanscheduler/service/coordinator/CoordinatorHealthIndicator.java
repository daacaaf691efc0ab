package com.example.scanscheduler.service.coordinator;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the coordinator as UP only once the initial schedule load has
 * completed and the watcher loop is running
 */
@Component("schedulerCoordinatorHealthIndicator")
@RequiredArgsConstructor
public class CoordinatorHealthIndicator implements HealthIndicator {

    private final SchedulerCoordinator coordinator;

    @Override
    public Health health() {
        var state = coordinator.getState();
        var builder = state == CoordinatorState.RUNNING ? Health.up() : Health.down();
        return builder
                .withDetail("state", state)
                .withDetail("scheduled", coordinator.getScheduledCount())
                .withDetail("known", coordinator.getKnownCount())
                .build();
    }
}
