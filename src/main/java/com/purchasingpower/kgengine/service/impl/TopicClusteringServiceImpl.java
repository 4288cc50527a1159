package com.purchasingpower.kgengine.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import com.purchasingpower.kgengine.configuration.AppProperties;
import com.purchasingpower.kgengine.configuration.GraphProperties;
import com.purchasingpower.kgengine.configuration.TopicIdStrategy;
import com.purchasingpower.kgengine.core.EmbeddingRecord;
import com.purchasingpower.kgengine.core.GraphIds;
import com.purchasingpower.kgengine.core.GraphNode;
import com.purchasingpower.kgengine.core.NodeLabel;
import com.purchasingpower.kgengine.core.RelationshipType;
import com.purchasingpower.kgengine.core.TopicNode;
import com.purchasingpower.kgengine.knowledge.GraphQuery;
import com.purchasingpower.kgengine.knowledge.GraphRows;
import com.purchasingpower.kgengine.knowledge.GraphStore;
import com.purchasingpower.kgengine.knowledge.RelationshipRequest;
import com.purchasingpower.kgengine.knowledge.VectorStore;
import com.purchasingpower.kgengine.model.build.TopicClusterResult;
import com.purchasingpower.kgengine.service.TopicClusteringService;
import com.purchasingpower.kgengine.similarity.GreedySeedClustering;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class TopicClusteringServiceImpl implements TopicClusteringService {

    private final GraphStore graphStore;
    private final VectorStore vectorStore;
    private final AppProperties appProperties;

    @Override
    public TopicClusterResult buildTopicClusters() {
        GraphProperties graph = appProperties.getGraph();
        return buildTopicClusters(graph.getMinClusterSize(), graph.getTopicSimilarityThreshold());
    }

    @Override
    public TopicClusterResult buildTopicClusters(int minClusterSize, double similarityThreshold) {
        Preconditions.checkArgument(minClusterSize >= 1, "minClusterSize must be >= 1, got %s", minClusterSize);
        Preconditions.checkArgument(similarityThreshold >= -1.0 && similarityThreshold <= 1.0,
            "similarityThreshold must be between -1 and 1, got %s", similarityThreshold);
        long startTime = System.currentTimeMillis();
        log.info("Building topic clusters (minClusterSize={}, threshold={})", minClusterSize, similarityThreshold);

        List<Map<String, Object>> conceptRows = graphStore.query(GraphQuery.allConcepts());
        if (conceptRows.size() < minClusterSize) {
            log.info("Not enough concepts for clustering ({} found)", conceptRows.size());
            return TopicClusterResult.empty(conceptRows.size());
        }

        Map<String, float[]> vectorsByConcept = new LinkedHashMap<>();
        for (Map<String, Object> row : conceptRows) {
            String conceptId = GraphRows.string(row, GraphRows.ID);
            conceptVector(conceptId).ifPresent(vector -> vectorsByConcept.put(conceptId, vector));
        }
        log.debug("{} of {} concepts have an embedding", vectorsByConcept.size(), conceptRows.size());

        List<List<String>> clusters = GreedySeedClustering.cluster(vectorsByConcept, similarityThreshold, minClusterSize);
        log.info("Found {} topic clusters", clusters.size());

        TopicIdStrategy idStrategy = appProperties.getGraph().getTopicIdStrategy();
        String createdAt = Instant.now().toString();
        List<TopicNode> topics = new ArrayList<>();

        for (int i = 0; i < clusters.size(); i++) {
            List<String> members = clusters.get(i);
            String topicId = topicId(idStrategy, i + 1, members);
            String topicName = "Topic Cluster " + (i + 1);

            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("id", topicId);
            properties.put("name", topicName);
            properties.put("conceptCount", members.size());
            properties.put("createdAt", createdAt);
            try {
                graphStore.createNode(NodeLabel.TOPIC, properties);
            } catch (Exception e) {
                log.error("❌ Failed to create topic {}: {}", topicId, e.getMessage());
                continue;
            }

            for (String conceptId : members) {
                try {
                    graphStore.createRelationship(RelationshipRequest.builder()
                        .fromId(topicId)
                        .fromLabel(NodeLabel.TOPIC)
                        .toId(conceptId)
                        .toLabel(NodeLabel.CONCEPT)
                        .type(RelationshipType.CONTAINS)
                        .properties(Map.of("createdAt", createdAt))
                        .build());
                } catch (Exception e) {
                    log.warn("⚠️ Failed to link concept {} to topic {}: {}", conceptId, topicId, e.getMessage());
                }
            }
            topics.add(TopicNode.builder().id(topicId).name(topicName).memberConceptIds(members).build());
        }

        log.info("✅ Created {} topic clusters", topics.size());
        return TopicClusterResult.builder()
            .conceptsScanned(conceptRows.size())
            .clusterableConcepts(vectorsByConcept.size())
            .clustersCreated(topics.size())
            .topics(topics)
            .durationMs(System.currentTimeMillis() - startTime)
            .build();
    }

    /**
     * Embedding of the first Activity the Concept was learned from.
     */
    private Optional<float[]> conceptVector(String conceptId) {
        try {
            List<Map<String, Object>> activities = graphStore.query(GraphQuery.activitiesForConcept(conceptId));
            if (activities.isEmpty()) {
                return Optional.empty();
            }
            GraphNode activity = GraphRows.node(activities.get(0), GraphRows.ACTIVITY);
            String embeddingId = GraphIds.embeddingIdForActivity(GraphIds.rawActivityId(activity.id()));
            return vectorStore.getEmbeddingById(embeddingId).map(EmbeddingRecord::getVector);
        } catch (Exception e) {
            log.debug("No embedding for concept {}: {}", conceptId, e.getMessage());
            return Optional.empty();
        }
    }

    static String topicId(TopicIdStrategy strategy, int ordinal, List<String> memberConceptIds) {
        if (strategy == TopicIdStrategy.CONTENT_HASH) {
            String members = String.join("\n", memberConceptIds.stream().sorted().toList());
            return GraphIds.TOPIC_PREFIX
                + Hashing.sha256().hashString(members, StandardCharsets.UTF_8).toString().substring(0, 16);
        }
        return GraphIds.sequentialTopicId(ordinal);
    }
}
