package com.purchasingpower.kgengine.knowledge;

import com.purchasingpower.kgengine.core.GraphNode;

import java.util.Map;

/**
 * A neighbour of a node together with the connecting edge.
 */
public record RelatedNode(GraphNode node, String relationshipType, Map<String, Object> relationshipProperties) {
}
