package com.purchasingpower.kgengine.service.impl;

import com.purchasingpower.kgengine.core.NodeLabel;
import com.purchasingpower.kgengine.core.RelationshipType;
import com.purchasingpower.kgengine.exception.GraphStoreException;
import com.purchasingpower.kgengine.knowledge.GraphFixtures;
import com.purchasingpower.kgengine.knowledge.GraphQuery;
import com.purchasingpower.kgengine.knowledge.GraphStore;
import com.purchasingpower.kgengine.knowledge.RelationshipRequest;
import com.purchasingpower.kgengine.knowledge.impl.InMemoryGraphStoreImpl;
import com.purchasingpower.kgengine.model.graph.ConceptDetails;
import com.purchasingpower.kgengine.model.graph.NodeSubgraph;
import com.purchasingpower.kgengine.model.graph.TopicSummary;
import com.purchasingpower.kgengine.model.graph.VisualizationData;
import com.purchasingpower.kgengine.model.graph.VisualizationEdge;
import com.purchasingpower.kgengine.model.graph.VisualizationNode;
import com.purchasingpower.kgengine.model.graph.VisualizationOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Graph visualization service")
class GraphVisualizationServiceImplTest {

    private InMemoryGraphStoreImpl graphStore;
    private GraphVisualizationServiceImpl service;

    @BeforeEach
    void setUp() {
        graphStore = new InMemoryGraphStoreImpl();
        service = new GraphVisualizationServiceImpl(graphStore);

        // a1 <- Java -RELATED_TO- Kotlin -> a2
        GraphFixtures.activityWithConcept(graphStore, "a1", "Java");
        GraphFixtures.activityWithConcept(graphStore, "a2", "Kotlin");
        graphStore.createRelationship(RelationshipRequest.builder()
            .fromId("concept_java")
            .fromLabel(NodeLabel.CONCEPT)
            .toId("concept_kotlin")
            .toLabel(NodeLabel.CONCEPT)
            .type(RelationshipType.RELATED_TO)
            .properties(Map.of("similarity", 0.8))
            .build());
    }

    @Test
    @DisplayName("Edges touching Activities are dropped when activities are excluded")
    void excludesActivities() {
        VisualizationData data = service.getVisualizationData(new VisualizationOptions(200, false, false, 1));

        assertThat(data.getNodes()).extracting(VisualizationNode::getId)
            .containsExactly("concept_java", "concept_kotlin");
        assertThat(data.getEdges()).extracting(VisualizationEdge::getType).containsExactly("RELATED_TO");
        assertThat(data.getTopics()).isEmpty();
        assertEquals(2, data.getStats().nodeCount());
    }

    @Test
    @DisplayName("Nodes below the minimum degree are dropped with their edges")
    void filtersByDegree() {
        VisualizationData data = service.getVisualizationData(new VisualizationOptions(200, true, false, 2));

        assertThat(data.getNodes()).extracting(VisualizationNode::getId)
            .containsExactly("concept_java", "concept_kotlin");
        assertThat(data.getNodes()).extracting(VisualizationNode::getLabel).containsExactly("Java", "Kotlin");
        assertThat(data.getEdges()).hasSize(1);
    }

    @Test
    @DisplayName("Topics are listed with their member concept names")
    void listsTopics() {
        graphStore.createNode(NodeLabel.TOPIC, Map.of("id", "topic_1", "name", "Topic Cluster 1", "conceptCount", 2));
        for (String conceptId : List.of("concept_java", "concept_kotlin")) {
            graphStore.createRelationship(RelationshipRequest.builder()
                .fromId("topic_1")
                .fromLabel(NodeLabel.TOPIC)
                .toId(conceptId)
                .toLabel(NodeLabel.CONCEPT)
                .type(RelationshipType.CONTAINS)
                .build());
        }

        VisualizationData data = service.getVisualizationData(VisualizationOptions.defaults());

        assertThat(data.getTopics()).singleElement().satisfies(topic -> {
            assertEquals("Topic Cluster 1", topic.getName());
            assertThat(topic.getConcepts()).containsExactly("Java", "Kotlin");
            assertEquals(2, topic.getConceptCount());
        });
        assertEquals(1, data.getStats().topicCount());
    }

    @Test
    @DisplayName("An unreadable graph yields an empty payload")
    void emptyOnFailure() {
        GraphStore failing = mock(GraphStore.class);
        when(failing.query(any(GraphQuery.class))).thenThrow(new GraphStoreException("offline"));
        GraphVisualizationServiceImpl failingService = new GraphVisualizationServiceImpl(failing);

        VisualizationData data = failingService.getVisualizationData(VisualizationOptions.defaults());
        List<TopicSummary> topics = failingService.getTopicData();

        assertThat(data.getNodes()).isEmpty();
        assertThat(data.getEdges()).isEmpty();
        assertThat(topics).isEmpty();
    }

    @Test
    @DisplayName("Concept details resolve by name and include similar concepts and activities")
    void conceptDetails() {
        Optional<ConceptDetails> details = service.getConceptDetails("Java", 10);

        assertTrue(details.isPresent());
        assertEquals("Java", details.get().getConcept().getName());
        assertThat(details.get().getRelated()).singleElement().satisfies(related -> {
            assertEquals("Kotlin", related.name());
            assertEquals("RELATED_TO", related.relationshipType());
            assertEquals(0.8, related.similarity(), 1e-9);
        });
        assertThat(details.get().getActivities()).singleElement()
            .satisfies(activity -> assertEquals("activity_a1", activity.getId()));
    }

    @Test
    @DisplayName("Unknown concepts yield no details")
    void unknownConcept() {
        assertThat(service.getConceptDetails("Haskell", 10)).isEmpty();
    }

    @Test
    @DisplayName("A depth-one subgraph holds the node's direct edges")
    void subgraph() {
        NodeSubgraph subgraph = service.getNodeSubgraph("concept_java", 1, 50);

        assertEquals("concept_java", subgraph.getCenterNodeId());
        assertThat(subgraph.getEdges()).extracting(VisualizationEdge::getType)
            .containsExactlyInAnyOrder("LEARNED_FROM", "RELATED_TO");
        assertThat(subgraph.getNodes()).extracting(VisualizationNode::getId)
            .containsExactlyInAnyOrder("concept_java", "activity_a1", "concept_kotlin");
    }

    @Test
    @DisplayName("Subgraph limits above the maximum are rejected")
    void subgraphLimit() {
        assertThatThrownBy(() -> service.getNodeSubgraph("concept_java", 2, 501))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
