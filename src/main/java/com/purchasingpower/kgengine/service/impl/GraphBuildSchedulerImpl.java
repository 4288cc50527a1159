package com.purchasingpower.kgengine.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.kgengine.configuration.AppProperties;
import com.purchasingpower.kgengine.configuration.GraphProperties;
import com.purchasingpower.kgengine.configuration.SchedulerConfig;
import com.purchasingpower.kgengine.configuration.SchedulerProperties;
import com.purchasingpower.kgengine.model.build.BuildOptions;
import com.purchasingpower.kgengine.model.build.BuildTriggerResult;
import com.purchasingpower.kgengine.model.build.KnowledgeGraphBuildResult;
import com.purchasingpower.kgengine.model.build.SchedulerStatus;
import com.purchasingpower.kgengine.service.GraphBuildScheduler;
import com.purchasingpower.kgengine.service.KnowledgeGraphService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs builds on a fixed rate and on demand, never two at once.
 *
 * <p>The first periodic build runs one interval after {@link #start(long)}.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class GraphBuildSchedulerImpl implements GraphBuildScheduler {

    private final KnowledgeGraphService knowledgeGraphService;
    private final TaskScheduler taskScheduler;
    private final AppProperties appProperties;
    private final BuildGuard buildGuard = new BuildGuard();

    private final Object scheduleLock = new Object();
    private ScheduledFuture<?> scheduledBuild;

    public GraphBuildSchedulerImpl(KnowledgeGraphService knowledgeGraphService,
                                   @Qualifier(SchedulerConfig.GRAPH_BUILD_SCHEDULER) TaskScheduler taskScheduler,
                                   AppProperties appProperties) {
        this.knowledgeGraphService = knowledgeGraphService;
        this.taskScheduler = taskScheduler;
        this.appProperties = appProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        SchedulerProperties scheduler = appProperties.getGraph().getScheduler();
        if (scheduler.isEnabled()) {
            start(scheduler.getIntervalMs());
        } else {
            log.info("Graph scheduler disabled (app.graph.scheduler.enabled=false)");
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Override
    public void start() {
        start(appProperties.getGraph().getScheduler().getIntervalMs());
    }

    @Override
    public void start(long intervalMs) {
        Preconditions.checkArgument(intervalMs > 0, "intervalMs must be positive, got %s", intervalMs);
        synchronized (scheduleLock) {
            if (scheduledBuild != null) {
                log.warn("⚠️ Graph scheduler already started");
                return;
            }
            scheduledBuild = taskScheduler.scheduleAtFixedRate(this::runScheduledBuild,
                Instant.now().plusMillis(intervalMs), Duration.ofMillis(intervalMs));
        }
        log.info("✅ Graph scheduler started, building every {} minutes", intervalMs / 60_000.0);
    }

    @Override
    public void stop() {
        synchronized (scheduleLock) {
            if (scheduledBuild == null) {
                return;
            }
            scheduledBuild.cancel(false);
            scheduledBuild = null;
        }
        log.info("Graph scheduler stopped");
    }

    @Override
    public BuildTriggerResult triggerManualBuild() {
        return triggerManualBuild(BuildOptions.defaults());
    }

    @Override
    public BuildTriggerResult triggerManualBuild(BuildOptions options) {
        BuildOptions effective = resolve(options);
        if (!buildGuard.tryAcquire()) {
            log.info("Manual graph build rejected: a build is already running");
            return BuildTriggerResult.alreadyRunning();
        }
        try {
            log.info("Manual graph build triggered");
            KnowledgeGraphBuildResult results = knowledgeGraphService.buildKnowledgeGraph(effective);
            return BuildTriggerResult.success(results);
        } catch (Exception e) {
            log.error("❌ Manual graph build failed", e);
            return BuildTriggerResult.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            buildGuard.release();
        }
    }

    @Override
    public SchedulerStatus status() {
        synchronized (scheduleLock) {
            return new SchedulerStatus(buildGuard.isHeld(), scheduledBuild != null);
        }
    }

    /**
     * Fills unset options from {@code app.graph.*} and rejects out-of-range values with
     * {@link IllegalArgumentException} before any build work starts.
     */
    private BuildOptions resolve(BuildOptions options) {
        GraphProperties graph = appProperties.getGraph();
        BuildOptions effective = (options != null ? options : BuildOptions.defaults()).withDefaults(graph);
        checkThreshold("conceptThreshold", effective.getConceptThreshold());
        checkThreshold("activityThreshold", effective.getActivityThreshold());
        checkThreshold("topicSimilarityThreshold", effective.getTopicSimilarityThreshold());
        Preconditions.checkArgument(effective.getLimit() >= 1 && effective.getLimit() <= graph.getMaxEmbeddingLimit(),
            "limit must be between 1 and %s, got %s", graph.getMaxEmbeddingLimit(), effective.getLimit());
        Preconditions.checkArgument(effective.getMinClusterSize() >= 1,
            "minClusterSize must be >= 1, got %s", effective.getMinClusterSize());
        return effective;
    }

    private static void checkThreshold(String name, double value) {
        Preconditions.checkArgument(value >= -1.0 && value <= 1.0, "%s must be between -1 and 1, got %s", name, value);
    }

    void runScheduledBuild() {
        if (!buildGuard.tryAcquire()) {
            log.info("Graph build already in progress, skipping scheduled run");
            return;
        }
        try {
            log.info("Starting scheduled graph build");
            knowledgeGraphService.buildKnowledgeGraph(BuildOptions.defaults());
        } catch (Exception e) {
            // Next tick retries; nothing to report to
            log.error("❌ Scheduled graph build failed", e);
        } finally {
            buildGuard.release();
        }
    }
}
