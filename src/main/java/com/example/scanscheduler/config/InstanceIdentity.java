package com.example.scanscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.util.UUID;

/**
 * Identity of this scheduler instance
 */
@Slf4j
@Component
public class InstanceIdentity {

    private final String id;

    public InstanceIdentity(ScanSchedulerProperties properties, @Value("${HOSTNAME:unknown}") String hostname) {
        this.id = resolve(properties.getInstanceId(), hostname);
        log.info("Scheduler instance id: {}", id);
    }

    public String getId() {
        return id;
    }

    private static String resolve(String configured, String hostname) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        try {
            var host = InetAddress.getLocalHost().getHostName();
            return host + "-" + ProcessHandle.current().pid();
        } catch (Exception e) {
            return hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }
}
