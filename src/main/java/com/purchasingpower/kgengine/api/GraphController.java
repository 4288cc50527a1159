package com.purchasingpower.kgengine.api;

import com.purchasingpower.kgengine.exception.ApiError;
import com.purchasingpower.kgengine.model.build.BuildOptions;
import com.purchasingpower.kgengine.model.build.BuildTriggerResult;
import com.purchasingpower.kgengine.model.build.GraphStatistics;
import com.purchasingpower.kgengine.model.build.SchedulerStatus;
import com.purchasingpower.kgengine.model.graph.NodeSubgraph;
import com.purchasingpower.kgengine.model.graph.TopicSummary;
import com.purchasingpower.kgengine.model.graph.VisualizationData;
import com.purchasingpower.kgengine.model.graph.VisualizationOptions;
import com.purchasingpower.kgengine.service.GraphBuildScheduler;
import com.purchasingpower.kgengine.service.GraphVisualizationService;
import com.purchasingpower.kgengine.service.KnowledgeGraphService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for graph builds and graph views.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/graph")
@RequiredArgsConstructor
public class GraphController {

    private final KnowledgeGraphService knowledgeGraphService;
    private final GraphBuildScheduler graphBuildScheduler;
    private final GraphVisualizationService visualizationService;

    /**
     * Full build with optional overrides. Goes through the same single-flight guard as
     * scheduled builds; 409 when one is already running.
     *
     * POST /api/v1/graph/build
     */
    @PostMapping("/build")
    public ResponseEntity<BuildTriggerResult> build(@RequestBody(required = false) BuildOptions options) {
        BuildTriggerResult result = graphBuildScheduler.triggerManualBuild(
            options != null ? options : BuildOptions.defaults());
        return toResponse(result);
    }

    /**
     * POST /api/v1/graph/build/trigger
     */
    @PostMapping("/build/trigger")
    public ResponseEntity<BuildTriggerResult> triggerBuild() {
        return toResponse(graphBuildScheduler.triggerManualBuild());
    }

    @GetMapping("/scheduler/status")
    public ResponseEntity<SchedulerStatus> getSchedulerStatus() {
        return ResponseEntity.ok(graphBuildScheduler.status());
    }

    @PostMapping("/scheduler/start")
    public ResponseEntity<SchedulerStatus> startScheduler(@RequestParam(required = false) Long intervalMs) {
        if (intervalMs != null) {
            graphBuildScheduler.start(intervalMs);
        } else {
            graphBuildScheduler.start();
        }
        return ResponseEntity.ok(graphBuildScheduler.status());
    }

    @PostMapping("/scheduler/stop")
    public ResponseEntity<SchedulerStatus> stopScheduler() {
        graphBuildScheduler.stop();
        return ResponseEntity.ok(graphBuildScheduler.status());
    }

    @GetMapping("/stats")
    public ResponseEntity<GraphStatistics> getGraphStatistics() {
        return ResponseEntity.ok(knowledgeGraphService.getGraphStatistics());
    }

    /**
     * GET /api/v1/graph/visualization?limit=200&amp;includeActivities=true&amp;includeTopics=true&amp;minNodeDegree=1
     */
    @GetMapping("/visualization")
    public ResponseEntity<VisualizationData> getVisualizationData(
            @RequestParam(defaultValue = "200") int limit,
            @RequestParam(defaultValue = "true") boolean includeActivities,
            @RequestParam(defaultValue = "true") boolean includeTopics,
            @RequestParam(defaultValue = "1") int minNodeDegree) {
        VisualizationOptions options = new VisualizationOptions(limit, includeActivities, includeTopics, minNodeDegree);
        return ResponseEntity.ok(visualizationService.getVisualizationData(options));
    }

    /**
     * GET /api/v1/graph/concepts/{name}
     */
    @GetMapping("/concepts/{name}")
    public ResponseEntity<?> getConceptDetails(@PathVariable String name,
                                               @RequestParam(defaultValue = "10") int limit,
                                               HttpServletRequest request) {
        return visualizationService.getConceptDetails(name, limit)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.builder()
                .errorId(UUID.randomUUID().toString().substring(0, 8))
                .code(ApiError.CONCEPT_NOT_FOUND)
                .message("Concept not found: " + name)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build()));
    }

    @GetMapping("/topics")
    public ResponseEntity<List<TopicSummary>> getTopics() {
        return ResponseEntity.ok(visualizationService.getTopicData());
    }

    /**
     * GET /api/v1/graph/nodes/{nodeId}/subgraph?depth=2&amp;limit=50
     */
    @GetMapping("/nodes/{nodeId}/subgraph")
    public ResponseEntity<NodeSubgraph> getNodeSubgraph(@PathVariable String nodeId,
                                                        @RequestParam(defaultValue = "2") int depth,
                                                        @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(visualizationService.getNodeSubgraph(nodeId, depth, limit));
    }

    private ResponseEntity<BuildTriggerResult> toResponse(BuildTriggerResult result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(result);
        }
        if (BuildTriggerResult.ALREADY_IN_PROGRESS.equals(result.getMessage())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
        }
        log.warn("Graph build failed: {}", result.getError());
        return ResponseEntity.internalServerError().body(result);
    }
}
