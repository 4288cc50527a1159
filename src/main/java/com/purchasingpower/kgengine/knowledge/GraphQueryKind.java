package com.purchasingpower.kgengine.knowledge;

/**
 * Closed set of named read queries a {@link GraphStore} must answer.
 *
 * <p>Row shapes (keys in {@link GraphRows}):
 * <ul>
 *   <li>CONCEPTS_FOR_ACTIVITY - {@code conceptId}</li>
 *   <li>ALL_CONCEPTS - {@code id}, {@code name}; one row per Concept in a stable order</li>
 *   <li>ACTIVITIES_FOR_CONCEPT - {@code activity} ({@link com.purchasingpower.kgengine.core.GraphNode})</li>
 *   <li>ALL_RELATIONSHIPS - {@code relationship} ({@link com.purchasingpower.kgengine.core.GraphRelationship})</li>
 *   <li>TOPICS_WITH_CONCEPTS - {@code topicId}, {@code topicName}, {@code concepts} (list of names)</li>
 *   <li>NODE_SUBGRAPH - {@code relationship}, one row per distinct edge within the depth</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum GraphQueryKind {
    CONCEPTS_FOR_ACTIVITY,
    ALL_CONCEPTS,
    ACTIVITIES_FOR_CONCEPT,
    ALL_RELATIONSHIPS,
    TOPICS_WITH_CONCEPTS,
    NODE_SUBGRAPH
}
