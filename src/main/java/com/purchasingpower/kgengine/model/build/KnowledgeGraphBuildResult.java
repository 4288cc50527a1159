package com.purchasingpower.kgengine.model.build;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a full build. {@code topicClusters} is null when topics were not requested.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeGraphBuildResult {
    private RelationshipBuildResult conceptRelationships;
    private RelationshipBuildResult activityRelationships;
    private TopicClusterResult topicClusters;
    private long durationMs;

    public int totalRelationshipsCreated() {
        return conceptRelationships.getRelationshipsCreated() + activityRelationships.getRelationshipsCreated();
    }
}
