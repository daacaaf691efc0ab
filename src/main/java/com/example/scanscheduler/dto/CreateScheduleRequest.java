package com.example.scanscheduler.dto;

import com.example.scanscheduler.domain.enums.ScanType;
import com.example.scanscheduler.domain.enums.ScheduleFrequency;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Request DTO for creating a scan schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateScheduleRequest {

    @NotBlank(message = "Domain is required")
    private String domain;

    private UUID domainConfigId;

    private UUID profileId;

    @NotNull(message = "Frequency is required")
    private ScheduleFrequency frequency;

    /**
     * Time specification matching the frequency
     */
    @NotNull(message = "Time config is required")
    private Map<String, Object> timeConfig;

    @Builder.Default
    private boolean enabled = true;

    /**
     * Defaults to QUICK
     */
    private ScanType scanType;

    private Map<String, Object> scanParams;

    private String description;

    private String createdBy;
}
