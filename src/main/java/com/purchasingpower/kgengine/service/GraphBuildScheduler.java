package com.purchasingpower.kgengine.service;

import com.purchasingpower.kgengine.model.build.BuildOptions;
import com.purchasingpower.kgengine.model.build.BuildTriggerResult;
import com.purchasingpower.kgengine.model.build.SchedulerStatus;

/**
 * Periodic and manual graph builds. At most one build runs at a time; a request that
 * arrives while one is running is rejected, not queued.
 *
 * @since 1.0.0
 */
public interface GraphBuildScheduler {

    /**
     * Install the periodic task. No-op if already started.
     */
    void start(long intervalMs);

    /**
     * Start with the configured interval.
     */
    void start();

    /**
     * Cancel the periodic task. A build in flight runs to completion.
     */
    void stop();

    /**
     * @throws IllegalArgumentException if a threshold or limit is out of range; checked
     *         before the build guard is taken
     */
    BuildTriggerResult triggerManualBuild(BuildOptions options);

    BuildTriggerResult triggerManualBuild();

    SchedulerStatus status();
}
