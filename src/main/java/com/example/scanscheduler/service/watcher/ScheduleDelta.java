package com.example.scanscheduler.service.watcher;

import com.example.scanscheduler.domain.entity.ScanSchedule;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Changes found by one watcher cycle relative to the known fingerprints.
 * <p>
 * A skipped delta means the store could not be read; it carries no
 * changes and the known set must be left as it is.
 */
@Value
@Builder
public class ScheduleDelta {

    @Builder.Default
    List<ScanSchedule> added = List.of();

    @Builder.Default
    List<ScanSchedule> updated = List.of();

    @Builder.Default
    Set<UUID> removed = Set.of();

    /**
     * Current fingerprints of the added and updated schedules
     */
    @Builder.Default
    Map<UUID, String> fingerprints = Map.of();

    boolean skipped;

    public static ScheduleDelta skippedCycle() {
        return ScheduleDelta.builder().skipped(true).build();
    }

    public boolean isEmpty() {
        return added.isEmpty() && updated.isEmpty() && removed.isEmpty();
    }
}
