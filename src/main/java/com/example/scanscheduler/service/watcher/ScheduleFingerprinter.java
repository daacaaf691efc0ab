package com.example.scanscheduler.service.watcher;

import com.example.scanscheduler.domain.entity.ScanSchedule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content fingerprint of the schedule fields that affect scheduling.
 * <p>
 * SHA-256 over canonical JSON (keys sorted at every level) of domain,
 * profile, frequency, time config, enabled flag, scan type and scan params.
 * Run bookkeeping, audit timestamps and the description are left out, so
 * writing them never looks like a definition change.
 */
@Component
public class ScheduleFingerprinter {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    public String fingerprint(ScanSchedule schedule) {
        var content = new TreeMap<String, Object>();
        content.put("domain", schedule.getDomain());
        content.put("profile_id", schedule.getProfileId() != null ? schedule.getProfileId().toString() : null);
        content.put("frequency", schedule.getFrequency() != null ? schedule.getFrequency().name() : null);
        content.put("time_config", schedule.getTimeConfig() != null ? schedule.getTimeConfig() : Map.of());
        content.put("enabled", schedule.isEnabled());
        content.put("scan_type", schedule.getScanType() != null ? schedule.getScanType().name() : null);
        content.put("scan_params", schedule.getScanParams() != null ? schedule.getScanParams() : Map.of());

        try {
            var json = CANONICAL_MAPPER.writeValueAsBytes(content);
            var digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Schedule " + schedule.getId() + " cannot be serialized for fingerprinting", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
