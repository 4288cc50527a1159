package com.purchasingpower.kgengine.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Greedy seed clustering")
class GreedySeedClusteringTest {

    @Test
    @DisplayName("Similar items join the first seed; small clusters are dropped")
    void groupsAroundSeeds() {
        // Given: three items near the x axis, two near the y axis
        Map<String, float[]> vectors = new LinkedHashMap<>();
        vectors.put("x1", new float[]{1f, 0.05f});
        vectors.put("y1", new float[]{0.05f, 1f});
        vectors.put("x2", new float[]{1f, 0.1f});
        vectors.put("x3", new float[]{1f, 0f});
        vectors.put("y2", new float[]{0.1f, 1f});

        // When
        List<List<String>> clusters = GreedySeedClustering.cluster(vectors, 0.9, 3);

        // Then: the y-cluster has only two members
        assertThat(clusters).containsExactly(List.of("x1", "x2", "x3"));
    }

    @Test
    @DisplayName("Mutually identical items join at threshold 1.0")
    void similarityEqualToThresholdJoins() {
        Map<String, float[]> vectors = new LinkedHashMap<>();
        vectors.put("a", new float[]{1f, 0f, 0f});
        vectors.put("b", new float[]{1f, 0f, 0f});
        vectors.put("c", new float[]{1f, 0f, 0f});

        List<List<String>> clusters = GreedySeedClustering.cluster(vectors, 1.0, 3);

        assertThat(clusters).containsExactly(List.of("a", "b", "c"));
    }

    @Test
    @DisplayName("Items are compared with the seed, not with other members")
    void seedOnlyComparison() {
        // Given: a-b similar, b-c similar, a-c not
        Map<String, float[]> vectors = new LinkedHashMap<>();
        vectors.put("a", new float[]{1f, 0f});
        vectors.put("b", new float[]{0.7071f, 0.7071f});
        vectors.put("c", new float[]{0f, 1f});

        // When
        List<List<String>> clusters = GreedySeedClustering.cluster(vectors, 0.7, 1);

        // Then
        assertThat(clusters).containsExactly(List.of("a", "b"), List.of("c"));
    }

    @Test
    @DisplayName("Vectors of another dimension never join")
    void mismatchedDimensionIsolated() {
        Map<String, float[]> vectors = new LinkedHashMap<>();
        vectors.put("a", new float[]{1f, 0f});
        vectors.put("b", new float[]{1f, 0f, 0f});
        vectors.put("c", new float[]{1f, 0f});

        List<List<String>> clusters = GreedySeedClustering.cluster(vectors, 0.5, 2);

        assertThat(clusters).containsExactly(List.of("a", "c"));
    }

    @Test
    @DisplayName("Empty input yields no clusters")
    void emptyInput() {
        assertThat(GreedySeedClustering.cluster(new LinkedHashMap<String, float[]>(), 0.5, 1)).isEmpty();
    }
}
