package com.purchasingpower.kgengine.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.kgengine.configuration.AppProperties;
import com.purchasingpower.kgengine.configuration.GraphProperties;
import com.purchasingpower.kgengine.core.EmbeddingRecord;
import com.purchasingpower.kgengine.core.GraphIds;
import com.purchasingpower.kgengine.core.NodeLabel;
import com.purchasingpower.kgengine.core.RelationshipType;
import com.purchasingpower.kgengine.exception.DimensionMismatchException;
import com.purchasingpower.kgengine.knowledge.EdgeWriteOutcome;
import com.purchasingpower.kgengine.knowledge.GraphQuery;
import com.purchasingpower.kgengine.knowledge.GraphRows;
import com.purchasingpower.kgengine.knowledge.GraphStore;
import com.purchasingpower.kgengine.knowledge.RelationshipRequest;
import com.purchasingpower.kgengine.knowledge.VectorStore;
import com.purchasingpower.kgengine.model.build.RelationshipBuildResult;
import com.purchasingpower.kgengine.service.RelationshipBuilderService;
import com.purchasingpower.kgengine.similarity.SimilarityEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Similarity edge builder.
 *
 * <p>Processed-pair sets live only for one call; repeated calls rely on the graph store's
 * idempotent edge writes.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelationshipBuilderServiceImpl implements RelationshipBuilderService {

    static final String SIMILARITY_SOURCE = "embedding_similarity";

    private final VectorStore vectorStore;
    private final GraphStore graphStore;
    private final AppProperties appProperties;

    @Override
    public RelationshipBuildResult buildConceptRelationships() {
        GraphProperties graph = appProperties.getGraph();
        return buildConceptRelationships(graph.getConceptThreshold(), graph.getConceptLimit());
    }

    @Override
    public RelationshipBuildResult buildActivityRelationships() {
        GraphProperties graph = appProperties.getGraph();
        return buildActivityRelationships(graph.getActivityThreshold(), graph.getActivityLimit());
    }

    @Override
    public RelationshipBuildResult buildConceptRelationships(double threshold, int limit) {
        validate(threshold, limit);
        long startTime = System.currentTimeMillis();
        log.info("Building concept relationships (threshold={}, limit={})", threshold, limit);

        List<EmbeddingRecord> embeddings = vectorStore.getAllEmbeddings(limit);
        if (embeddings.size() < 2) {
            log.info("Not enough embeddings to build concept relationships ({} found)", embeddings.size());
            return RelationshipBuildResult.empty(RelationshipType.RELATED_TO, embeddings.size());
        }

        PairScan scan = scanPairs(embeddings, threshold, (a, b) -> unorderedKey(a.getId(), b.getId()));
        EdgeTally tally = new EdgeTally();
        Map<String, List<String>> conceptsByActivity = new HashMap<>();
        Set<String> attemptedConceptPairs = new HashSet<>();
        String createdAt = Instant.now().toString();

        for (SimilarPair pair : scan.pairs()) {
            List<String> conceptsA = conceptsOf(pair.first().getOwnerActivityId(), conceptsByActivity);
            List<String> conceptsB = conceptsOf(pair.second().getOwnerActivityId(), conceptsByActivity);
            if (conceptsA.isEmpty() || conceptsB.isEmpty()) {
                log.debug("Skipping pair {} / {}: no concepts on one side", pair.first().getId(), pair.second().getId());
                continue;
            }

            for (String conceptA : conceptsA) {
                for (String conceptB : conceptsB) {
                    if (conceptA.equals(conceptB) || !attemptedConceptPairs.add(unorderedKey(conceptA, conceptB))) {
                        continue;
                    }
                    tally.record(writeEdge(RelationshipRequest.builder()
                        .fromId(conceptA)
                        .fromLabel(NodeLabel.CONCEPT)
                        .toId(conceptB)
                        .toLabel(NodeLabel.CONCEPT)
                        .type(RelationshipType.RELATED_TO)
                        .properties(similarityProperties(pair.similarity(), createdAt))
                        .build()));
                }
            }
        }

        RelationshipBuildResult result = tally.toResult(RelationshipType.RELATED_TO, embeddings.size(), scan,
            System.currentTimeMillis() - startTime);
        log.info("✅ Created {} concept relationships ({} similar pairs, {} already existed, {} failed)",
            result.getRelationshipsCreated(), result.getQualifyingPairs(),
            result.getAlreadyExisting(), result.getFailures());
        return result;
    }

    @Override
    public RelationshipBuildResult buildActivityRelationships(double threshold, int limit) {
        validate(threshold, limit);
        long startTime = System.currentTimeMillis();
        log.info("Building activity relationships (threshold={}, limit={})", threshold, limit);

        List<EmbeddingRecord> embeddings = vectorStore.getAllEmbeddings(limit);
        if (embeddings.size() < 2) {
            log.info("Not enough embeddings to build activity relationships ({} found)", embeddings.size());
            return RelationshipBuildResult.empty(RelationshipType.CONNECTS, embeddings.size());
        }

        PairScan scan = scanPairs(embeddings, threshold,
            (a, b) -> unorderedKey(a.getOwnerActivityId(), b.getOwnerActivityId()));
        EdgeTally tally = new EdgeTally();
        String createdAt = Instant.now().toString();

        for (SimilarPair pair : scan.pairs()) {
            tally.record(writeEdge(RelationshipRequest.builder()
                .fromId(GraphIds.activityId(pair.first().getOwnerActivityId()))
                .fromLabel(NodeLabel.ACTIVITY)
                .toId(GraphIds.activityId(pair.second().getOwnerActivityId()))
                .toLabel(NodeLabel.ACTIVITY)
                .type(RelationshipType.CONNECTS)
                .properties(similarityProperties(pair.similarity(), createdAt))
                .build()));
        }

        RelationshipBuildResult result = tally.toResult(RelationshipType.CONNECTS, embeddings.size(), scan,
            System.currentTimeMillis() - startTime);
        log.info("✅ Created {} activity relationships ({} similar pairs, {} already existed, {} failed)",
            result.getRelationshipsCreated(), result.getQualifyingPairs(),
            result.getAlreadyExisting(), result.getFailures());
        return result;
    }

    /**
     * Compares every unordered pair once. Pairs whose dedup key was already taken are not
     * compared again; a key is taken only by a pair at or above the threshold.
     */
    private PairScan scanPairs(List<EmbeddingRecord> embeddings, double threshold,
                               BiFunction<EmbeddingRecord, EmbeddingRecord, String> dedupKey) {
        List<SimilarPair> pairs = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        long comparisons = 0;

        for (int i = 0; i < embeddings.size(); i++) {
            EmbeddingRecord first = embeddings.get(i);
            if (!first.hasOwner()) {
                log.debug("Embedding {} has no owning activity, skipping", first.getId());
                continue;
            }
            for (int j = i + 1; j < embeddings.size(); j++) {
                EmbeddingRecord second = embeddings.get(j);
                if (!second.hasOwner() || first.getOwnerActivityId().equals(second.getOwnerActivityId())) {
                    continue;
                }
                String key = dedupKey.apply(first, second);
                if (processed.contains(key)) {
                    continue;
                }

                comparisons++;
                Optional<Double> similarity = similarity(first, second);
                if (similarity.isPresent() && similarity.get() >= threshold) {
                    processed.add(key);
                    pairs.add(new SimilarPair(first, second, similarity.get()));
                }
            }
        }
        log.debug("Compared {} pairs, {} at or above {}", comparisons, pairs.size(), threshold);
        return new PairScan(pairs, comparisons);
    }

    private Optional<Double> similarity(EmbeddingRecord first, EmbeddingRecord second) {
        try {
            return Optional.of(SimilarityEngine.cosineSimilarity(first.getVector(), second.getVector()));
        } catch (DimensionMismatchException e) {
            log.debug("Treating {} / {} as dissimilar: {}", first.getId(), second.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<String> conceptsOf(String rawActivityId, Map<String, List<String>> cache) {
        return cache.computeIfAbsent(rawActivityId, id -> {
            try {
                return graphStore.query(GraphQuery.conceptsForActivity(GraphIds.activityId(id))).stream()
                    .map(row -> GraphRows.string(row, GraphRows.CONCEPT_ID))
                    .toList();
            } catch (Exception e) {
                log.warn("⚠️ Could not resolve concepts for activity {}: {}", id, e.getMessage());
                return List.of();
            }
        });
    }

    private Optional<EdgeWriteOutcome> writeEdge(RelationshipRequest request) {
        try {
            return Optional.of(graphStore.createRelationship(request));
        } catch (Exception e) {
            log.warn("⚠️ Failed to create relationship {}: {}", request.describe(), e.getMessage());
            return Optional.empty();
        }
    }

    private Map<String, Object> similarityProperties(double similarity, String createdAt) {
        return Map.of(
            "similarity", similarity,
            "source", SIMILARITY_SOURCE,
            "createdAt", createdAt
        );
    }

    private void validate(double threshold, int limit) {
        int ceiling = appProperties.getGraph().getMaxEmbeddingLimit();
        Preconditions.checkArgument(threshold >= -1.0 && threshold <= 1.0,
            "threshold must be between -1 and 1, got %s", threshold);
        Preconditions.checkArgument(limit >= 1 && limit <= ceiling,
            "limit must be between 1 and %s, got %s", ceiling, limit);
    }

    static String unorderedKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }

    private record SimilarPair(EmbeddingRecord first, EmbeddingRecord second, double similarity) {
    }

    private record PairScan(List<SimilarPair> pairs, long comparisons) {
    }

    private static final class EdgeTally {
        private int created;
        private int existing;
        private int failed;

        void record(Optional<EdgeWriteOutcome> outcome) {
            if (outcome.isEmpty()) {
                failed++;
            } else if (outcome.get() == EdgeWriteOutcome.CREATED) {
                created++;
            } else {
                existing++;
            }
        }

        RelationshipBuildResult toResult(RelationshipType type, int scanned, PairScan scan, long durationMs) {
            return RelationshipBuildResult.builder()
                .relationshipType(type)
                .embeddingsScanned(scanned)
                .pairsCompared(scan.comparisons())
                .qualifyingPairs(scan.pairs().size())
                .relationshipsCreated(created)
                .alreadyExisting(existing)
                .failures(failed)
                .durationMs(durationMs)
                .build();
        }
    }
}
