package com.example.scanscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Scan service connection properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.scan-service")
public class ScanServiceProperties {
    @NotBlank
    private String baseUrl;
    /**
     * Timeout of a single HTTP request, not of the scan
     */
    @Min(1)
    private int timeoutSeconds = 30;
    /**
     * Delay between status reads of a running scan
     */
    @Min(10)
    private long pollIntervalMs = 10000;
}
