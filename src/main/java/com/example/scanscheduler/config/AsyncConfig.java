package com.example.scanscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Executors and time source shared by the scheduler components.
 * <p>
 * The engine owns its timer and execution pool. The pool defined here runs
 * the blocking scan service calls so an execution thread can wait on them
 * with a timeout.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    /**
     * Executor for outbound scan task calls.
     * Sized like the execution pool, one call per running execution.
     */
    @Bean(name = "scanTaskExecutor")
    public ThreadPoolTaskExecutor scanTaskExecutor(ScanSchedulerProperties properties) {
        var poolSize = properties.getMaxConcurrentExecutions();
        log.info("Creating scan task executor with {} threads", poolSize);

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        // Timed-out calls may still occupy a thread until the HTTP timeout fires
        executor.setQueueCapacity(poolSize * 10);
        executor.setThreadNamePrefix("scan-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getShutdownGracePeriodSeconds());
        executor.initialize();

        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
