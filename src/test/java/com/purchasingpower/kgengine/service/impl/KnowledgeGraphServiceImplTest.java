package com.purchasingpower.kgengine.service.impl;

import com.purchasingpower.kgengine.configuration.AppProperties;
import com.purchasingpower.kgengine.core.RelationshipType;
import com.purchasingpower.kgengine.exception.GraphStoreException;
import com.purchasingpower.kgengine.knowledge.GraphStats;
import com.purchasingpower.kgengine.knowledge.GraphStore;
import com.purchasingpower.kgengine.model.build.BuildOptions;
import com.purchasingpower.kgengine.model.build.GraphStatistics;
import com.purchasingpower.kgengine.model.build.KnowledgeGraphBuildResult;
import com.purchasingpower.kgengine.model.build.RelationshipBuildResult;
import com.purchasingpower.kgengine.model.build.TopicClusterResult;
import com.purchasingpower.kgengine.service.RelationshipBuilderService;
import com.purchasingpower.kgengine.service.TopicClusteringService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Knowledge graph service")
class KnowledgeGraphServiceImplTest {

    private RelationshipBuilderService relationshipBuilder;

    private TopicClusteringService topicClustering;

    private GraphStore graphStore;

    private KnowledgeGraphServiceImpl service;

    @BeforeEach
    void setUp() {
        relationshipBuilder = mock(RelationshipBuilderService.class);
        topicClustering = mock(TopicClusteringService.class);
        graphStore = mock(GraphStore.class);
        service = new KnowledgeGraphServiceImpl(relationshipBuilder, topicClustering, graphStore, new AppProperties());
    }

    @Test
    @DisplayName("Defaults run concepts, then activities, then topics with one shared limit")
    void defaultBuild() {
        // Given
        when(relationshipBuilder.buildConceptRelationships(0.7, 100))
            .thenReturn(created(RelationshipType.RELATED_TO, 4));
        when(relationshipBuilder.buildActivityRelationships(0.75, 100))
            .thenReturn(created(RelationshipType.CONNECTS, 2));
        when(topicClustering.buildTopicClusters(3, 0.65))
            .thenReturn(TopicClusterResult.builder().clustersCreated(1).build());

        // When
        KnowledgeGraphBuildResult result = service.buildKnowledgeGraph(BuildOptions.defaults());

        // Then
        InOrder order = inOrder(relationshipBuilder, topicClustering);
        order.verify(relationshipBuilder).buildConceptRelationships(0.7, 100);
        order.verify(relationshipBuilder).buildActivityRelationships(0.75, 100);
        order.verify(topicClustering).buildTopicClusters(3, 0.65);
        assertEquals(6, result.totalRelationshipsCreated());
        assertEquals(1, result.getTopicClusters().getClustersCreated());
    }

    @Test
    @DisplayName("Explicit options override defaults and buildTopics=false skips clustering")
    void overriddenOptions() {
        when(relationshipBuilder.buildConceptRelationships(0.8, 20))
            .thenReturn(created(RelationshipType.RELATED_TO, 0));
        when(relationshipBuilder.buildActivityRelationships(0.9, 20))
            .thenReturn(created(RelationshipType.CONNECTS, 0));

        KnowledgeGraphBuildResult result = service.buildKnowledgeGraph(BuildOptions.builder()
            .conceptThreshold(0.8)
            .activityThreshold(0.9)
            .limit(20)
            .buildTopics(false)
            .build());

        assertNull(result.getTopicClusters());
        verify(topicClustering, never()).buildTopicClusters(anyInt(), anyDouble());
    }

    @Test
    @DisplayName("Graph statistics include totals")
    void statistics() {
        when(graphStore.getGraphStats()).thenReturn(new GraphStats(
            Map.of("Concept", 5L, "Activity", 3L), Map.of("RELATED_TO", 4L)));

        GraphStatistics stats = service.getGraphStatistics();

        assertEquals(8, stats.getTotalNodes());
        assertEquals(4, stats.getTotalRelationships());
        assertThat(stats.getNodes()).containsEntry("Concept", 5L);
    }

    @Test
    @DisplayName("Statistics failures propagate")
    void statisticsFailure() {
        when(graphStore.getGraphStats()).thenThrow(new GraphStoreException("offline"));

        assertThatThrownBy(() -> service.getGraphStatistics()).isInstanceOf(GraphStoreException.class);
    }

    private static RelationshipBuildResult created(RelationshipType type, int count) {
        return RelationshipBuildResult.builder().relationshipType(type).relationshipsCreated(count).build();
    }
}
