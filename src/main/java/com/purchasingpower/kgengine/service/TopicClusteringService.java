package com.purchasingpower.kgengine.service;

import com.purchasingpower.kgengine.model.build.TopicClusterResult;

/**
 * Groups Concepts into Topics by the embedding of the first Activity each Concept
 * was learned from.
 *
 * @since 1.0.0
 */
public interface TopicClusteringService {

    /**
     * Greedy single pass over the Concepts; each cluster of at least {@code minClusterSize}
     * becomes a Topic node with one CONTAINS edge per member.
     *
     * @throws com.purchasingpower.kgengine.exception.GraphStoreException if Concepts cannot be listed
     */
    TopicClusterResult buildTopicClusters(int minClusterSize, double similarityThreshold);

    TopicClusterResult buildTopicClusters();
}
