package com.purchasingpower.kgengine.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.kgengine.core.ActivityNode;
import com.purchasingpower.kgengine.core.ConceptNode;
import com.purchasingpower.kgengine.core.GraphIds;
import com.purchasingpower.kgengine.core.GraphNode;
import com.purchasingpower.kgengine.core.GraphRelationship;
import com.purchasingpower.kgengine.core.NodeLabel;
import com.purchasingpower.kgengine.core.RelationshipType;
import com.purchasingpower.kgengine.knowledge.GraphQuery;
import com.purchasingpower.kgengine.knowledge.GraphRows;
import com.purchasingpower.kgengine.knowledge.GraphStore;
import com.purchasingpower.kgengine.knowledge.RelatedNode;
import com.purchasingpower.kgengine.model.graph.ConceptDetails;
import com.purchasingpower.kgengine.model.graph.GraphSnapshot;
import com.purchasingpower.kgengine.model.graph.NodeSubgraph;
import com.purchasingpower.kgengine.model.graph.TopicSummary;
import com.purchasingpower.kgengine.model.graph.VisualizationData;
import com.purchasingpower.kgengine.model.graph.VisualizationOptions;
import com.purchasingpower.kgengine.service.GraphVisualizationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphVisualizationServiceImpl implements GraphVisualizationService {

    private static final int MAX_SUBGRAPH_LIMIT = 500;

    private final GraphStore graphStore;

    @Override
    public VisualizationData getVisualizationData(VisualizationOptions options) {
        List<GraphRelationship> relationships;
        try {
            relationships = graphStore.query(GraphQuery.allRelationships(options.limit())).stream()
                .map(GraphRows::relationship)
                .toList();
        } catch (Exception e) {
            // A build may be writing; the next poll sees a consistent graph
            log.error("❌ Failed to load graph for visualization: {}", e.getMessage());
            return VisualizationData.empty();
        }

        GraphSnapshot snapshot = GraphSnapshot.fold(relationships, options.includeActivities())
            .filterByMinDegree(options.minNodeDegree());
        List<TopicSummary> topics = options.includeTopics() ? getTopicData() : List.of();

        log.debug("Visualization: {} nodes, {} edges, {} topics",
            snapshot.getNodes().size(), snapshot.getEdges().size(), topics.size());
        return VisualizationData.of(snapshot, topics);
    }

    @Override
    public List<TopicSummary> getTopicData() {
        try {
            List<TopicSummary> topics = new ArrayList<>();
            for (Map<String, Object> row : graphStore.query(GraphQuery.topicsWithConcepts())) {
                List<String> concepts = GraphRows.stringList(row, GraphRows.CONCEPTS);
                topics.add(TopicSummary.builder()
                    .id(GraphRows.string(row, GraphRows.TOPIC_ID))
                    .name(GraphRows.string(row, GraphRows.TOPIC_NAME))
                    .concepts(concepts)
                    .conceptCount(concepts.size())
                    .build());
            }
            return topics;
        } catch (Exception e) {
            log.warn("⚠️ Failed to load topics: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public Optional<ConceptDetails> getConceptDetails(String conceptName, int limit) {
        Preconditions.checkArgument(limit >= 1, "limit must be >= 1, got %s", limit);
        String conceptId = GraphIds.conceptId(conceptName);

        Optional<GraphNode> concept = graphStore.getNodeById(conceptId, NodeLabel.CONCEPT);
        if (concept.isEmpty()) {
            log.debug("Concept {} not found", conceptId);
            return Optional.empty();
        }

        List<ConceptDetails.RelatedConcept> related = new ArrayList<>();
        for (RelatedNode neighbour : graphStore.getRelatedNodes(conceptId, NodeLabel.CONCEPT,
                RelationshipType.RELATED_TO, limit)) {
            Object similarity = neighbour.relationshipProperties().get("similarity");
            related.add(new ConceptDetails.RelatedConcept(
                neighbour.node().displayName(),
                neighbour.relationshipType(),
                similarity instanceof Number n ? n.doubleValue() : 0.0));
        }

        List<ActivityNode> activities = graphStore.query(GraphQuery.activitiesForConcept(conceptId)).stream()
            .limit(limit)
            .map(row -> ActivityNode.from(GraphRows.node(row, GraphRows.ACTIVITY)))
            .toList();

        return Optional.of(ConceptDetails.builder()
            .concept(ConceptNode.from(concept.get()))
            .related(related)
            .activities(activities)
            .build());
    }

    @Override
    public NodeSubgraph getNodeSubgraph(String nodeId, int depth, int limit) {
        Preconditions.checkArgument(limit >= 1 && limit <= MAX_SUBGRAPH_LIMIT,
            "limit must be between 1 and %s, got %s", MAX_SUBGRAPH_LIMIT, limit);

        List<GraphRelationship> relationships = graphStore.query(GraphQuery.nodeSubgraph(nodeId, depth, limit)).stream()
            .map(GraphRows::relationship)
            .toList();
        GraphSnapshot snapshot = GraphSnapshot.fold(relationships, true);

        return NodeSubgraph.builder()
            .centerNodeId(nodeId)
            .nodes(snapshot.getNodes())
            .edges(snapshot.getEdges())
            .build();
    }
}
