package com.example.scanscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scan Scheduler Service Application
 * <p>
 * Turns persisted scan schedules into executed scan jobs across several
 * cooperating instances that share one PostgreSQL database.
 * <p>
 * Features:
 * - Database-backed leases so each due occurrence runs at most once
 * - Content-fingerprint change detection, no restart needed for edits
 * - Durable execution history with aggregate statistics
 * - Soft per-execution timeouts with lease renewal for long scans
 */
@EnableScheduling
@SpringBootApplication
public class ScanSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanSchedulerApplication.class, args);
    }
}
