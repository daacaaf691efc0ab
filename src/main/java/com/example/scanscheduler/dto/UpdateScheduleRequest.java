package com.example.scanscheduler.dto;

import com.example.scanscheduler.domain.enums.ScanType;
import com.example.scanscheduler.domain.enums.ScheduleFrequency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Partial update of a scan schedule. Null fields are left unchanged.
 * <p>
 * When the frequency changes, a matching time config must be supplied too.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateScheduleRequest {

    private String domain;
    private UUID profileId;
    private ScheduleFrequency frequency;
    private Map<String, Object> timeConfig;
    private Boolean enabled;
    private ScanType scanType;
    private Map<String, Object> scanParams;
    private String description;
}
