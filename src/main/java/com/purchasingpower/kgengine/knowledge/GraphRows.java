package com.purchasingpower.kgengine.knowledge;

import com.purchasingpower.kgengine.core.GraphNode;
import com.purchasingpower.kgengine.core.GraphRelationship;

import java.util.List;
import java.util.Map;

/**
 * Row keys of the named queries and typed accessors for them.
 */
public final class GraphRows {

    public static final String CONCEPT_ID = "conceptId";
    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String ACTIVITY = "activity";
    public static final String RELATIONSHIP = "relationship";
    public static final String TOPIC_ID = "topicId";
    public static final String TOPIC_NAME = "topicName";
    public static final String CONCEPTS = "concepts";

    private GraphRows() {
    }

    public static String string(Map<String, Object> row, String key) {
        Object value = row.get(key);
        return value == null ? null : value.toString();
    }

    public static GraphNode node(Map<String, Object> row, String key) {
        return (GraphNode) row.get(key);
    }

    public static GraphRelationship relationship(Map<String, Object> row) {
        return (GraphRelationship) row.get(RELATIONSHIP);
    }

    @SuppressWarnings("unchecked")
    public static List<String> stringList(Map<String, Object> row, String key) {
        Object value = row.get(key);
        return value == null ? List.of() : (List<String>) value;
    }
}
