package com.example.scanscheduler.service.watcher;

import com.example.scanscheduler.config.SchedulerMetrics;
import com.example.scanscheduler.domain.entity.ScanSchedule;
import com.example.scanscheduler.service.schedule.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Detects schedule definition changes by comparing content fingerprints.
 * <p>
 * Stateless: the caller owns the known id to fingerprint map and passes
 * it in on every cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleChangeWatcher {

    private final ScheduleStore scheduleStore;
    private final ScheduleFingerprinter fingerprinter;
    private final SchedulerMetrics metrics;

    /**
     * Compare the enabled schedules in the store against {@code known}.
     * Never throws; a store failure produces a skipped delta.
     */
    public ScheduleDelta diff(Map<UUID, String> known) {
        List<ScanSchedule> enabled;
        try {
            enabled = scheduleStore.listEnabled();
        } catch (RuntimeException e) {
            log.warn("Schedule store unavailable, skipping watcher cycle: {}", e.getMessage());
            metrics.recordWatcherError();
            return ScheduleDelta.skippedCycle();
        }

        var added = new ArrayList<ScanSchedule>();
        var updated = new ArrayList<ScanSchedule>();
        var fingerprints = new HashMap<UUID, String>();
        var seen = new HashSet<UUID>();

        for (var schedule : enabled) {
            seen.add(schedule.getId());
            var fingerprint = fingerprinter.fingerprint(schedule);
            var previous = known.get(schedule.getId());
            if (previous == null) {
                added.add(schedule);
                fingerprints.put(schedule.getId(), fingerprint);
            } else if (!previous.equals(fingerprint)) {
                updated.add(schedule);
                fingerprints.put(schedule.getId(), fingerprint);
            }
        }

        var removed = new HashSet<>(known.keySet());
        removed.removeAll(seen);

        var delta = ScheduleDelta.builder()
                .added(added)
                .updated(updated)
                .removed(removed)
                .fingerprints(fingerprints)
                .build();

        if (delta.isEmpty()) {
            log.debug("No schedule changes ({} enabled)", seen.size());
        } else {
            log.info("Schedule changes detected: {} added, {} updated, {} removed",
                    added.size(), updated.size(), removed.size());
            metrics.recordWatcherChanges(added.size(), updated.size(), removed.size());
        }
        return delta;
    }
}
