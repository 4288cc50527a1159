package com.purchasingpower.kgengine.knowledge;

import com.google.common.base.Preconditions;

import java.util.Map;

/**
 * A named graph query with typed parameters. One record per {@link GraphQueryKind}.
 *
 * @since 1.0.0
 */
public interface GraphQuery {

    int MAX_SUBGRAPH_DEPTH = 5;

    GraphQueryKind kind();

    Map<String, Object> parameters();

    static GraphQuery conceptsForActivity(String activityId) {
        return new ConceptsForActivity(activityId);
    }

    static GraphQuery allConcepts() {
        return new AllConcepts();
    }

    static GraphQuery activitiesForConcept(String conceptId) {
        return new ActivitiesForConcept(conceptId);
    }

    static GraphQuery allRelationships(int limit) {
        return new AllRelationships(limit);
    }

    static GraphQuery topicsWithConcepts() {
        return new TopicsWithConcepts();
    }

    static GraphQuery nodeSubgraph(String nodeId, int depth, int limit) {
        return new NodeSubgraph(nodeId, depth, limit);
    }

    /**
     * @param activityId graph id of the Activity ({@code activity_<raw>})
     */
    record ConceptsForActivity(String activityId) implements GraphQuery {
        public ConceptsForActivity {
            Preconditions.checkNotNull(activityId, "activityId");
        }

        @Override
        public GraphQueryKind kind() {
            return GraphQueryKind.CONCEPTS_FOR_ACTIVITY;
        }

        @Override
        public Map<String, Object> parameters() {
            return Map.of("activityId", activityId);
        }
    }

    record AllConcepts() implements GraphQuery {
        @Override
        public GraphQueryKind kind() {
            return GraphQueryKind.ALL_CONCEPTS;
        }

        @Override
        public Map<String, Object> parameters() {
            return Map.of();
        }
    }

    record ActivitiesForConcept(String conceptId) implements GraphQuery {
        public ActivitiesForConcept {
            Preconditions.checkNotNull(conceptId, "conceptId");
        }

        @Override
        public GraphQueryKind kind() {
            return GraphQueryKind.ACTIVITIES_FOR_CONCEPT;
        }

        @Override
        public Map<String, Object> parameters() {
            return Map.of("conceptId", conceptId);
        }
    }

    record AllRelationships(int limit) implements GraphQuery {
        public AllRelationships {
            Preconditions.checkArgument(limit >= 1, "limit must be >= 1, got %s", limit);
        }

        @Override
        public GraphQueryKind kind() {
            return GraphQueryKind.ALL_RELATIONSHIPS;
        }

        @Override
        public Map<String, Object> parameters() {
            return Map.of("limit", limit);
        }
    }

    record TopicsWithConcepts() implements GraphQuery {
        @Override
        public GraphQueryKind kind() {
            return GraphQueryKind.TOPICS_WITH_CONCEPTS;
        }

        @Override
        public Map<String, Object> parameters() {
            return Map.of();
        }
    }

    record NodeSubgraph(String nodeId, int depth, int limit) implements GraphQuery {
        public NodeSubgraph {
            Preconditions.checkNotNull(nodeId, "nodeId");
            Preconditions.checkArgument(depth >= 1 && depth <= MAX_SUBGRAPH_DEPTH,
                "depth must be between 1 and %s, got %s", MAX_SUBGRAPH_DEPTH, depth);
            Preconditions.checkArgument(limit >= 1, "limit must be >= 1, got %s", limit);
        }

        @Override
        public GraphQueryKind kind() {
            return GraphQueryKind.NODE_SUBGRAPH;
        }

        @Override
        public Map<String, Object> parameters() {
            return Map.of("nodeId", nodeId, "limit", limit);
        }
    }
}
