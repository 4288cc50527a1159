package com.purchasingpower.kgengine.knowledge;

import java.util.Map;

/**
 * Node counts per label and relationship counts per type.
 */
public record GraphStats(Map<String, Long> nodes, Map<String, Long> relationships) {

    public long totalNodes() {
        return nodes.values().stream().mapToLong(Long::longValue).sum();
    }

    public long totalRelationships() {
        return relationships.values().stream().mapToLong(Long::longValue).sum();
    }
}
