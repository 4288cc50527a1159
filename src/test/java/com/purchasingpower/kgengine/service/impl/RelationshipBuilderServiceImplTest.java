package com.purchasingpower.kgengine.service.impl;

import com.purchasingpower.kgengine.configuration.AppProperties;
import com.purchasingpower.kgengine.core.EmbeddingRecord;
import com.purchasingpower.kgengine.core.NodeLabel;
import com.purchasingpower.kgengine.core.RelationshipType;
import com.purchasingpower.kgengine.exception.EmbeddingRetrievalException;
import com.purchasingpower.kgengine.exception.GraphStoreException;
import com.purchasingpower.kgengine.knowledge.EdgeWriteOutcome;
import com.purchasingpower.kgengine.knowledge.GraphFixtures;
import com.purchasingpower.kgengine.knowledge.GraphQuery;
import com.purchasingpower.kgengine.knowledge.GraphRows;
import com.purchasingpower.kgengine.knowledge.GraphStore;
import com.purchasingpower.kgengine.knowledge.InMemoryVectorStore;
import com.purchasingpower.kgengine.knowledge.RelationshipRequest;
import com.purchasingpower.kgengine.knowledge.impl.InMemoryGraphStoreImpl;
import com.purchasingpower.kgengine.model.build.RelationshipBuildResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Relationship builder")
class RelationshipBuilderServiceImplTest {

    // sim(A,B)=0.9, sim(C,D)=0.95, sim(A,C)=0.3, all other pairs below 0.5
    static final float[] A = {1f, 0f, 0f, 0f};
    static final float[] B = {0.9f, 0.43589f, 0f, 0f};
    static final float[] C = {0.3f, 0f, 0.95394f, 0f};
    static final float[] D = {0.285f, 0f, 0.90624f, 0.31225f};

    private InMemoryGraphStoreImpl graphStore;
    private InMemoryVectorStore vectorStore;
    private RelationshipBuilderServiceImpl builder;

    @BeforeEach
    void setUp() {
        graphStore = new InMemoryGraphStoreImpl();
        vectorStore = new InMemoryVectorStore();
        builder = new RelationshipBuilderServiceImpl(vectorStore, graphStore, new AppProperties());
    }

    private void seedFourActivities() {
        GraphFixtures.activityWithConcept(graphStore, "a", "Alpha");
        GraphFixtures.activityWithConcept(graphStore, "b", "Beta");
        GraphFixtures.activityWithConcept(graphStore, "c", "Gamma");
        GraphFixtures.activityWithConcept(graphStore, "d", "Delta");
        vectorStore.addForActivity("a", A)
            .addForActivity("b", B)
            .addForActivity("c", C)
            .addForActivity("d", D);
    }

    @Test
    @DisplayName("A pair exactly at the threshold is linked")
    void similarityEqualToThresholdQualifies() {
        // Given: identical vectors on different activities, similarity exactly 1.0
        GraphFixtures.activityWithConcept(graphStore, "a", "Alpha");
        GraphFixtures.activityWithConcept(graphStore, "b", "Beta");
        vectorStore.addForActivity("a", 1f, 0f, 0f)
            .addForActivity("b", 1f, 0f, 0f);

        // When
        RelationshipBuildResult result = builder.buildConceptRelationships(1.0, 100);

        // Then
        assertEquals(1, result.getQualifyingPairs());
        assertEquals(1, result.getRelationshipsCreated());
        assertThat(relatedConcepts("concept_alpha")).containsExactly("concept_beta");
    }

    @Test
    @DisplayName("Four embeddings at threshold 0.7 produce exactly A-B and C-D concept edges")
    void fourEmbeddingScenario() {
        // Given
        seedFourActivities();

        // When
        RelationshipBuildResult result = builder.buildConceptRelationships(0.7, 100);

        // Then
        assertEquals(2, result.getRelationshipsCreated());
        assertEquals(6, result.getPairsCompared());
        assertEquals(2, result.getQualifyingPairs());
        assertThat(relatedConcepts("concept_alpha")).containsExactly("concept_beta");
        assertThat(relatedConcepts("concept_gamma")).containsExactly("concept_delta");
        assertThat(relatedConcepts("concept_beta")).containsExactly("concept_alpha");
    }

    @Test
    @DisplayName("Edges carry similarity, source and creation time")
    void edgeProperties() {
        seedFourActivities();

        builder.buildConceptRelationships(0.7, 100);

        Map<String, Object> properties = graphStore
            .getRelatedNodes("concept_alpha", NodeLabel.CONCEPT, RelationshipType.RELATED_TO, 10)
            .get(0).relationshipProperties();
        assertThat((Double) properties.get("similarity")).isBetween(0.89, 0.91);
        assertEquals("embedding_similarity", properties.get("source"));
        assertThat(properties).containsKey("createdAt");
    }

    @Test
    @DisplayName("A second run creates nothing and reports the existing edges")
    void rerunIsIdempotent() {
        seedFourActivities();
        builder.buildConceptRelationships(0.7, 100);

        RelationshipBuildResult second = builder.buildConceptRelationships(0.7, 100);

        assertEquals(0, second.getRelationshipsCreated());
        assertEquals(2, second.getAlreadyExisting());
        assertThat(graphStore.getGraphStats().relationships()).containsEntry("RELATED_TO", 2L);
    }

    @Test
    @DisplayName("Activity pass links the owning activities of similar embeddings")
    void activityRelationships() {
        seedFourActivities();

        RelationshipBuildResult result = builder.buildActivityRelationships(0.75, 50);

        assertEquals(RelationshipType.CONNECTS, result.getRelationshipType());
        assertEquals(2, result.getRelationshipsCreated());
        assertThat(graphStore.getRelatedNodes("activity_a", NodeLabel.ACTIVITY, RelationshipType.CONNECTS, 10))
            .extracting(r -> r.node().id())
            .containsExactly("activity_b");
    }

    @Test
    @DisplayName("Embeddings of the same activity are never compared")
    void sameActivitySkipped() {
        GraphFixtures.activityWithConcept(graphStore, "a", "Alpha");
        vectorStore.addForActivity("a", A);
        vectorStore.add(EmbeddingRecord.builder()
            .id("chunk_a_2").vector(A).ownerActivityId("a").build());

        RelationshipBuildResult concepts = builder.buildConceptRelationships(0.5, 100);
        RelationshipBuildResult activities = builder.buildActivityRelationships(0.5, 100);

        assertEquals(0, concepts.getPairsCompared());
        assertEquals(0, activities.getRelationshipsCreated());
        assertThat(graphStore.getGraphStats().relationships()).containsOnlyKeys("LEARNED_FROM");
    }

    @Test
    @DisplayName("The same concept pair is attempted once per build even when several embedding pairs map to it")
    void conceptPairAttemptedOnce() {
        // Given: three activities, activities 2 and 3 share one concept
        GraphFixtures.activityWithConcept(graphStore, "1", "Alpha");
        GraphFixtures.activityWithConcept(graphStore, "2", "Beta");
        GraphFixtures.activity(graphStore, "3");
        GraphFixtures.learnedFrom(graphStore, "concept_beta", "3");
        vectorStore.addForActivity("1", A).addForActivity("2", A).addForActivity("3", A);

        // When
        RelationshipBuildResult result = builder.buildConceptRelationships(0.7, 100);

        // Then: (1,2) and (1,3) both map to alpha-beta; (2,3) maps to beta-beta
        assertEquals(3, result.getQualifyingPairs());
        assertEquals(1, result.getRelationshipsCreated());
        assertEquals(0, result.getAlreadyExisting());
    }

    @Test
    @DisplayName("Activities without concepts are skipped")
    void noConceptsSkipped() {
        GraphFixtures.activity(graphStore, "a");
        GraphFixtures.activityWithConcept(graphStore, "b", "Beta");
        vectorStore.addForActivity("a", A).addForActivity("b", A);

        RelationshipBuildResult result = builder.buildConceptRelationships(0.7, 100);

        assertEquals(1, result.getQualifyingPairs());
        assertEquals(0, result.getRelationshipsCreated());
    }

    @Test
    @DisplayName("Fewer than two embeddings build nothing")
    void tooFewEmbeddings() {
        vectorStore.addForActivity("a", A);

        assertEquals(0, builder.buildConceptRelationships(0.7, 100).getRelationshipsCreated());
        assertEquals(0, builder.buildActivityRelationships(0.75, 50).getRelationshipsCreated());
    }

    @Test
    @DisplayName("Mismatched dimensions are treated as not similar")
    void dimensionMismatchIsNotSimilar() {
        GraphFixtures.activityWithConcept(graphStore, "a", "Alpha");
        GraphFixtures.activityWithConcept(graphStore, "b", "Beta");
        vectorStore.addForActivity("a", A).addForActivity("b", 1f, 0f);

        RelationshipBuildResult result = builder.buildConceptRelationships(0.0, 100);

        assertEquals(0, result.getQualifyingPairs());
    }

    @Test
    @DisplayName("Limits outside 1..ceiling are rejected")
    void limitValidation() {
        assertThatThrownBy(() -> builder.buildConceptRelationships(0.7, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.buildActivityRelationships(0.7, 2001))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("2000");
        assertThatThrownBy(() -> builder.buildConceptRelationships(1.5, 10))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Vector store failures propagate")
    void retrievalFailurePropagates() {
        vectorStore.setFailing(true);

        assertThatThrownBy(() -> builder.buildConceptRelationships(0.7, 100))
            .isInstanceOf(EmbeddingRetrievalException.class);
    }

    @Test
    @DisplayName("A failed edge write is counted and the loop continues")
    void edgeFailureContinues() {
        // Given: one activity with two concepts, another with one
        GraphStore failingStore = mock(GraphStore.class);
        when(failingStore.query(GraphQuery.conceptsForActivity("activity_a")))
            .thenReturn(List.of(Map.of(GraphRows.CONCEPT_ID, "concept_x"), Map.of(GraphRows.CONCEPT_ID, "concept_y")));
        when(failingStore.query(GraphQuery.conceptsForActivity("activity_b")))
            .thenReturn(List.of(Map.of(GraphRows.CONCEPT_ID, "concept_z")));
        when(failingStore.createRelationship(any(RelationshipRequest.class)))
            .thenThrow(new GraphStoreException("write failed"))
            .thenReturn(EdgeWriteOutcome.CREATED);
        vectorStore.addForActivity("a", A).addForActivity("b", A);
        RelationshipBuilderServiceImpl failingBuilder =
            new RelationshipBuilderServiceImpl(vectorStore, failingStore, new AppProperties());

        // When
        RelationshipBuildResult result = failingBuilder.buildConceptRelationships(0.7, 100);

        // Then
        verify(failingStore, times(2)).createRelationship(any(RelationshipRequest.class));
        assertEquals(1, result.getFailures());
        assertEquals(1, result.getRelationshipsCreated());
    }

    private List<String> relatedConcepts(String conceptId) {
        return graphStore.getRelatedNodes(conceptId, NodeLabel.CONCEPT, RelationshipType.RELATED_TO, 10).stream()
            .map(r -> r.node().id())
            .toList();
    }
}
