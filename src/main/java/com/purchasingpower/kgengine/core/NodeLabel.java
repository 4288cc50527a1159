package com.purchasingpower.kgengine.core;

import java.util.Arrays;
import java.util.Optional;

/**
 * Node labels used in the knowledge graph.
 *
 * @since 1.0.0
 */
public enum NodeLabel {
    ACTIVITY("Activity"),
    CONCEPT("Concept"),
    TOPIC("Topic");

    private final String label;

    NodeLabel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<NodeLabel> fromLabel(String label) {
        return Arrays.stream(values())
            .filter(l -> l.label.equals(label))
            .findFirst();
    }
}
