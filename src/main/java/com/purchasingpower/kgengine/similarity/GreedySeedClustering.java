package com.purchasingpower.kgengine.similarity;

import com.google.common.base.Preconditions;
import com.purchasingpower.kgengine.exception.DimensionMismatchException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single-pass greedy clustering.
 *
 * <p>Items are visited in the map's iteration order. Each item not yet assigned seeds a
 * new cluster, and every other unassigned item whose similarity to the seed is at least
 * the threshold joins it. Clusters are never refined, so the result depends on input order.
 * Clusters smaller than {@code minClusterSize} are dropped; their members stay assigned.
 *
 * @since 1.0.0
 */
public final class GreedySeedClustering {

    private GreedySeedClustering() {
    }

    public static <K> List<List<K>> cluster(Map<K, float[]> orderedVectors, double threshold, int minClusterSize) {
        Preconditions.checkNotNull(orderedVectors, "orderedVectors");
        Preconditions.checkArgument(minClusterSize >= 1, "minClusterSize must be >= 1, got %s", minClusterSize);

        List<K> keys = new ArrayList<>(orderedVectors.keySet());
        Set<K> assigned = new HashSet<>();
        List<List<K>> clusters = new ArrayList<>();

        for (K seed : keys) {
            if (!assigned.add(seed)) {
                continue;
            }
            List<K> cluster = new ArrayList<>();
            cluster.add(seed);
            float[] seedVector = orderedVectors.get(seed);

            for (K candidate : keys) {
                if (assigned.contains(candidate)) {
                    continue;
                }
                if (isSimilar(seedVector, orderedVectors.get(candidate), threshold)) {
                    cluster.add(candidate);
                    assigned.add(candidate);
                }
            }

            if (cluster.size() >= minClusterSize) {
                clusters.add(List.copyOf(cluster));
            }
        }
        return clusters;
    }

    private static boolean isSimilar(float[] seed, float[] candidate, double threshold) {
        try {
            return SimilarityEngine.cosineSimilarity(seed, candidate) >= threshold;
        } catch (DimensionMismatchException e) {
            // vectors of another dimension never join the cluster
            return false;
        }
    }
}
