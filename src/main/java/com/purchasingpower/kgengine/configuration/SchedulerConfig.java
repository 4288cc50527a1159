package com.purchasingpower.kgengine.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler for periodic graph builds.
 *
 * One thread: ticks never overlap each other, and manual builds are kept out by the build guard.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    public static final String GRAPH_BUILD_SCHEDULER = "graphBuildTaskScheduler";

    @Bean(name = GRAPH_BUILD_SCHEDULER)
    public ThreadPoolTaskScheduler graphBuildTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("graph-build-");

        // An in-flight build is not cancelled on shutdown, only waited for
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);

        scheduler.initialize();

        log.info("✅ Graph build scheduler configured: pool={}", scheduler.getPoolSize());
        return scheduler;
    }
}
