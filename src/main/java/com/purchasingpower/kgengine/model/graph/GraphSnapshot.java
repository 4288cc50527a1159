package com.purchasingpower.kgengine.model.graph;

import com.purchasingpower.kgengine.core.GraphNode;
import com.purchasingpower.kgengine.core.GraphRelationship;
import com.purchasingpower.kgengine.core.NodeLabel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable node/edge view folded from a list of relationships.
 *
 * <p>A node's label and properties come from its first occurrence. Degree counts every
 * kept edge end, so a self-loop adds two.
 *
 * @since 1.0.0
 */
public final class GraphSnapshot {

    private final List<VisualizationNode> nodes;
    private final List<VisualizationEdge> edges;

    private GraphSnapshot(List<VisualizationNode> nodes, List<VisualizationEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    public static GraphSnapshot fold(List<GraphRelationship> relationships, boolean includeActivities) {
        Map<String, GraphNode> firstSeen = new LinkedHashMap<>();
        Map<String, Integer> degrees = new HashMap<>();
        List<VisualizationEdge> edges = new ArrayList<>();

        for (GraphRelationship relationship : relationships) {
            if (!includeActivities && relationship.touches(NodeLabel.ACTIVITY)) {
                continue;
            }
            for (GraphNode endpoint : List.of(relationship.from(), relationship.to())) {
                firstSeen.putIfAbsent(endpoint.id(), endpoint);
                degrees.merge(endpoint.id(), 1, Integer::sum);
            }
            edges.add(VisualizationEdge.of(relationship));
        }

        List<VisualizationNode> nodes = new ArrayList<>();
        firstSeen.values().forEach(node -> nodes.add(VisualizationNode.builder()
            .id(node.id())
            .label(node.displayName())
            .type(node.label())
            .properties(node.properties())
            .degree(degrees.get(node.id()))
            .build()));
        return new GraphSnapshot(nodes, edges);
    }

    /**
     * Keeps nodes with at least {@code minNodeDegree} edge ends and the edges between them.
     * Degrees are not recomputed.
     */
    public GraphSnapshot filterByMinDegree(int minNodeDegree) {
        List<VisualizationNode> keptNodes = new ArrayList<>();
        Set<String> keptIds = new HashSet<>();
        for (VisualizationNode node : nodes) {
            if (node.getDegree() >= minNodeDegree) {
                keptNodes.add(node);
                keptIds.add(node.getId());
            }
        }
        List<VisualizationEdge> keptEdges = edges.stream()
            .filter(edge -> keptIds.contains(edge.getSource()) && keptIds.contains(edge.getTarget()))
            .toList();
        return new GraphSnapshot(keptNodes, keptEdges);
    }

    public List<VisualizationNode> getNodes() {
        return nodes;
    }

    public List<VisualizationEdge> getEdges() {
        return edges;
    }
}
