package com.purchasingpower.kgengine.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A stored edge with both endpoints resolved.
 */
public record GraphRelationship(GraphNode from, GraphNode to, String type, Map<String, Object> properties) {

    public GraphRelationship {
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public boolean touches(NodeLabel label) {
        return from.hasLabel(label) || to.hasLabel(label);
    }
}
