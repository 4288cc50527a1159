package com.purchasingpower.kgengine.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.kgengine.core.GraphNode;
import com.purchasingpower.kgengine.core.GraphRelationship;
import com.purchasingpower.kgengine.core.NodeLabel;
import com.purchasingpower.kgengine.core.RelationshipType;
import com.purchasingpower.kgengine.exception.GraphStoreException;
import com.purchasingpower.kgengine.knowledge.EdgeWriteOutcome;
import com.purchasingpower.kgengine.knowledge.GraphQuery;
import com.purchasingpower.kgengine.knowledge.GraphRows;
import com.purchasingpower.kgengine.knowledge.GraphStats;
import com.purchasingpower.kgengine.knowledge.GraphStore;
import com.purchasingpower.kgengine.knowledge.RelatedNode;
import com.purchasingpower.kgengine.knowledge.RelationshipRequest;
import com.purchasingpower.kgengine.model.CallContext;
import com.purchasingpower.kgengine.model.ServiceType;
import com.purchasingpower.kgengine.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-process GraphStore for single-user deployments and tests.
 *
 * <p>Nodes keep insertion order, so ALL_CONCEPTS enumerates Concepts in the order they were
 * added. All methods are synchronized; readers never see a half-written edge.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.graph", name = "store", havingValue = "memory")
public class InMemoryGraphStoreImpl implements GraphStore {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<StoredEdge> edges = new ArrayList<>();
    private final Set<String> edgeKeys = new HashSet<>();

    @Override
    public synchronized GraphNode createNode(NodeLabel label, Map<String, Object> properties) {
        Object id = properties.get("id");
        Preconditions.checkArgument(id != null, "Node properties must contain an id");

        GraphNode existing = nodes.get(id.toString());
        if (existing != null) {
            log.debug("Node {} already exists, keeping stored properties", id);
            return existing;
        }
        GraphNode node = new GraphNode(id.toString(), label.getLabel(), properties);
        nodes.put(node.id(), node);
        return node;
    }

    @Override
    public synchronized EdgeWriteOutcome createRelationship(RelationshipRequest request) {
        GraphNode from = nodes.get(request.getFromId());
        GraphNode to = nodes.get(request.getToId());
        if (from == null || to == null
                || !from.hasLabel(request.getFromLabel()) || !to.hasLabel(request.getToLabel())) {
            throw new GraphStoreException("Cannot create relationship " + request.describe()
                + ": source or target node does not exist");
        }

        if (!edgeKeys.add(edgeKey(request.getFromId(), request.getToId(), request.getType()))) {
            return EdgeWriteOutcome.ALREADY_EXISTS;
        }
        edges.add(new StoredEdge(from.id(), to.id(), request.getType().name(), request.getProperties()));
        return EdgeWriteOutcome.CREATED;
    }

    @Override
    public synchronized List<Map<String, Object>> query(GraphQuery query) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.MEMORY_GRAPH, query.kind().name(), log);
        callCtx.logRequest(null, "parameters", ExternalCallLogger.formatMap(query.parameters()));

        List<Map<String, Object>> rows = new ArrayList<>();
        if (query instanceof GraphQuery.ConceptsForActivity q) {
            for (GraphNode concept : neighbours(q.activityId(), RelationshipType.LEARNED_FROM, NodeLabel.CONCEPT)) {
                rows.add(Map.of(GraphRows.CONCEPT_ID, concept.id()));
            }
        } else if (query instanceof GraphQuery.AllConcepts) {
            for (GraphNode node : nodes.values()) {
                if (node.hasLabel(NodeLabel.CONCEPT)) {
                    Map<String, Object> row = new HashMap<>();
                    row.put(GraphRows.ID, node.id());
                    row.put(GraphRows.NAME, node.stringProperty("name"));
                    rows.add(row);
                }
            }
        } else if (query instanceof GraphQuery.ActivitiesForConcept q) {
            for (GraphNode activity : neighbours(q.conceptId(), RelationshipType.LEARNED_FROM, NodeLabel.ACTIVITY)) {
                rows.add(Map.of(GraphRows.ACTIVITY, activity));
            }
        } else if (query instanceof GraphQuery.AllRelationships q) {
            edges.stream()
                .limit(q.limit())
                .forEach(edge -> rows.add(Map.of(GraphRows.RELATIONSHIP, resolve(edge))));
        } else if (query instanceof GraphQuery.TopicsWithConcepts) {
            for (GraphNode topic : nodes.values()) {
                if (!topic.hasLabel(NodeLabel.TOPIC)) {
                    continue;
                }
                List<String> conceptNames = new ArrayList<>();
                for (StoredEdge edge : edges) {
                    if (edge.fromId().equals(topic.id()) && edge.type().equals(RelationshipType.CONTAINS.name())) {
                        String name = nodes.get(edge.toId()).stringProperty("name");
                        if (name != null) {
                            conceptNames.add(name);
                        }
                    }
                }
                Map<String, Object> row = new HashMap<>();
                row.put(GraphRows.TOPIC_ID, topic.id());
                row.put(GraphRows.TOPIC_NAME, topic.stringProperty("name") != null ? topic.stringProperty("name") : topic.id());
                row.put(GraphRows.CONCEPTS, List.copyOf(conceptNames));
                rows.add(row);
            }
        } else if (query instanceof GraphQuery.NodeSubgraph q) {
            for (StoredEdge edge : subgraphEdges(q.nodeId(), q.depth(), q.limit())) {
                rows.add(Map.of(GraphRows.RELATIONSHIP, resolve(edge)));
            }
        } else {
            throw new GraphStoreException("Unsupported query kind: " + query.kind());
        }

        callCtx.logResponse(rows.size() + " rows");
        return rows;
    }

    @Override
    public synchronized List<RelatedNode> getRelatedNodes(String nodeId, NodeLabel neighbourLabel,
                                                          RelationshipType relationshipType, int limit) {
        List<RelatedNode> related = new ArrayList<>();
        for (StoredEdge edge : edges) {
            if (related.size() >= limit) {
                break;
            }
            if (relationshipType != null && !edge.type().equals(relationshipType.name())) {
                continue;
            }
            String otherId = edge.otherEnd(nodeId);
            if (otherId == null) {
                continue;
            }
            GraphNode other = nodes.get(otherId);
            if (neighbourLabel == null || other.hasLabel(neighbourLabel)) {
                related.add(new RelatedNode(other, edge.type(), edge.properties()));
            }
        }
        return related;
    }

    @Override
    public synchronized Optional<GraphNode> getNodeById(String nodeId, NodeLabel label) {
        GraphNode node = nodes.get(nodeId);
        return node != null && node.hasLabel(label) ? Optional.of(node) : Optional.empty();
    }

    @Override
    public synchronized GraphStats getGraphStats() {
        Map<String, Long> nodeCounts = new TreeMap<>();
        nodes.values().forEach(node -> nodeCounts.merge(node.label(), 1L, Long::sum));
        Map<String, Long> relationshipCounts = new TreeMap<>();
        edges.forEach(edge -> relationshipCounts.merge(edge.type(), 1L, Long::sum));
        return new GraphStats(nodeCounts, relationshipCounts);
    }

    private List<GraphNode> neighbours(String nodeId, RelationshipType type, NodeLabel label) {
        Set<GraphNode> found = new LinkedHashSet<>();
        for (StoredEdge edge : edges) {
            String otherId = edge.type().equals(type.name()) ? edge.otherEnd(nodeId) : null;
            if (otherId != null && nodes.get(otherId).hasLabel(label)) {
                found.add(nodes.get(otherId));
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Breadth-first walk ignoring direction; returns distinct edges within {@code depth} hops.
     */
    private List<StoredEdge> subgraphEdges(String startId, int depth, int limit) {
        Set<StoredEdge> collected = new LinkedHashSet<>();
        if (!nodes.containsKey(startId)) {
            return List.of();
        }
        Set<String> visited = new HashSet<>();
        visited.add(startId);
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(startId);

        for (int hop = 0; hop < depth && !frontier.isEmpty(); hop++) {
            Deque<String> next = new ArrayDeque<>();
            for (String current : frontier) {
                for (StoredEdge edge : edges) {
                    String otherId = edge.otherEnd(current);
                    if (otherId == null) {
                        continue;
                    }
                    collected.add(edge);
                    if (collected.size() >= limit) {
                        return new ArrayList<>(collected);
                    }
                    if (visited.add(otherId)) {
                        next.add(otherId);
                    }
                }
            }
            frontier = next;
        }
        return new ArrayList<>(collected);
    }

    private GraphRelationship resolve(StoredEdge edge) {
        return new GraphRelationship(nodes.get(edge.fromId()), nodes.get(edge.toId()), edge.type(), edge.properties());
    }

    private static String edgeKey(String fromId, String toId, RelationshipType type) {
        if (type.isSymmetric() && fromId.compareTo(toId) > 0) {
            return toId + "|" + type.name() + "|" + fromId;
        }
        return fromId + "|" + type.name() + "|" + toId;
    }

    private record StoredEdge(String fromId, String toId, String type, Map<String, Object> properties) {

        String otherEnd(String nodeId) {
            if (fromId.equals(nodeId)) {
                return toId;
            }
            return toId.equals(nodeId) ? fromId : null;
        }
    }
}
