package com.example.scanscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Depth of the scan requested from the scan service.
 */
@Getter
@RequiredArgsConstructor
public enum ScanType {

    /**
     * Main page plus any custom pages
     */
    QUICK("quick"),

    /**
     * Full crawl up to the configured page limit
     */
    DEEP("deep");

    private final String code;

    public static ScanType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown scan type code: " + code);
    }
}
