package com.purchasingpower.kgengine.knowledge;

import com.purchasingpower.kgengine.core.GraphIds;
import com.purchasingpower.kgengine.core.NodeLabel;
import com.purchasingpower.kgengine.core.RelationshipType;

import java.util.Map;

/**
 * Writes the nodes the ingestion pipeline would have written.
 */
public final class GraphFixtures {

    private GraphFixtures() {
    }

    public static void activity(GraphStore store, String rawActivityId) {
        store.createNode(NodeLabel.ACTIVITY, Map.of(
            "id", GraphIds.activityId(rawActivityId),
            "title", "Activity " + rawActivityId,
            "sourceType", "document",
            "timestamp", "2024-01-01T00:00:00Z"));
    }

    public static String concept(GraphStore store, String name) {
        String id = GraphIds.conceptId(name);
        store.createNode(NodeLabel.CONCEPT, Map.of("id", id, "name", name, "label", "topic", "confidence", 0.9));
        return id;
    }

    public static void learnedFrom(GraphStore store, String conceptId, String rawActivityId) {
        store.createRelationship(RelationshipRequest.builder()
            .fromId(conceptId)
            .fromLabel(NodeLabel.CONCEPT)
            .toId(GraphIds.activityId(rawActivityId))
            .toLabel(NodeLabel.ACTIVITY)
            .type(RelationshipType.LEARNED_FROM)
            .build());
    }

    /**
     * Activity with a single Concept learned from it.
     */
    public static String activityWithConcept(GraphStore store, String rawActivityId, String conceptName) {
        activity(store, rawActivityId);
        String conceptId = concept(store, conceptName);
        learnedFrom(store, conceptId, rawActivityId);
        return conceptId;
    }
}
