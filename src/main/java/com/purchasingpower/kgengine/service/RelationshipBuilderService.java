package com.purchasingpower.kgengine.service;

import com.purchasingpower.kgengine.exception.EmbeddingRetrievalException;
import com.purchasingpower.kgengine.model.build.RelationshipBuildResult;

/**
 * Writes similarity edges from pairwise comparison of stored embeddings.
 *
 * <p>Both passes compare every unordered pair of the fetched batch, skip embeddings that
 * belong to the same Activity, and attempt each edge at most once per call.
 * Per-edge write failures are logged and skipped.
 *
 * @since 1.0.0
 */
public interface RelationshipBuilderService {

    /**
     * RELATED_TO edges between the Concepts of Activities whose embeddings are similar.
     *
     * @throws EmbeddingRetrievalException if the vector store cannot be read
     * @throws IllegalArgumentException    if the threshold or limit is out of range
     */
    RelationshipBuildResult buildConceptRelationships(double threshold, int limit);

    RelationshipBuildResult buildConceptRelationships();

    /**
     * CONNECTS edges between Activities whose embeddings are similar.
     *
     * @throws EmbeddingRetrievalException if the vector store cannot be read
     * @throws IllegalArgumentException    if the threshold or limit is out of range
     */
    RelationshipBuildResult buildActivityRelationships(double threshold, int limit);

    RelationshipBuildResult buildActivityRelationships();
}
