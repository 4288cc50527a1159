package com.purchasingpower.kgengine.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node as read back from the graph store.
 *
 * @param id         node id
 * @param label      primary label ({@code Activity}, {@code Concept}, {@code Topic})
 * @param properties all stored properties, including {@code id}
 */
public record GraphNode(String id, String label, Map<String, Object> properties) {

    public GraphNode {
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Object property(String key) {
        return properties.get(key);
    }

    public String stringProperty(String key) {
        Object value = properties.get(key);
        return value == null ? null : value.toString();
    }

    /**
     * name, else title, else id.
     */
    public String displayName() {
        String name = stringProperty("name");
        if (name != null) {
            return name;
        }
        String title = stringProperty("title");
        return title != null ? title : id;
    }

    public boolean hasLabel(NodeLabel nodeLabel) {
        return nodeLabel.getLabel().equals(label);
    }
}
