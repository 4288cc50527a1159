package com.purchasingpower.kgengine.service.impl;

import com.purchasingpower.kgengine.configuration.AppProperties;
import com.purchasingpower.kgengine.knowledge.GraphStore;
import com.purchasingpower.kgengine.model.build.BuildOptions;
import com.purchasingpower.kgengine.model.build.GraphStatistics;
import com.purchasingpower.kgengine.model.build.KnowledgeGraphBuildResult;
import com.purchasingpower.kgengine.model.build.RelationshipBuildResult;
import com.purchasingpower.kgengine.model.build.TopicClusterResult;
import com.purchasingpower.kgengine.service.KnowledgeGraphService;
import com.purchasingpower.kgengine.service.RelationshipBuilderService;
import com.purchasingpower.kgengine.service.TopicClusteringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeGraphServiceImpl implements KnowledgeGraphService {

    private final RelationshipBuilderService relationshipBuilder;
    private final TopicClusteringService topicClustering;
    private final GraphStore graphStore;
    private final AppProperties appProperties;

    @Override
    public KnowledgeGraphBuildResult buildKnowledgeGraph(BuildOptions options) {
        BuildOptions effective = (options != null ? options : BuildOptions.defaults())
            .withDefaults(appProperties.getGraph());
        long startTime = System.currentTimeMillis();
        log.info("🔨 Building knowledge graph: {}", effective);

        RelationshipBuildResult concepts = relationshipBuilder.buildConceptRelationships(
            effective.getConceptThreshold(), effective.getLimit());
        RelationshipBuildResult activities = relationshipBuilder.buildActivityRelationships(
            effective.getActivityThreshold(), effective.getLimit());

        TopicClusterResult topics = null;
        if (effective.getBuildTopics()) {
            topics = topicClustering.buildTopicClusters(
                effective.getMinClusterSize(), effective.getTopicSimilarityThreshold());
        }

        KnowledgeGraphBuildResult result = KnowledgeGraphBuildResult.builder()
            .conceptRelationships(concepts)
            .activityRelationships(activities)
            .topicClusters(topics)
            .durationMs(System.currentTimeMillis() - startTime)
            .build();
        log.info("✅ Knowledge graph built in {}ms: {} concept edges, {} activity edges, {} topics",
            result.getDurationMs(),
            concepts.getRelationshipsCreated(),
            activities.getRelationshipsCreated(),
            topics != null ? topics.getClustersCreated() : 0);
        return result;
    }

    @Override
    public GraphStatistics getGraphStatistics() {
        return GraphStatistics.from(graphStore.getGraphStats());
    }
}
