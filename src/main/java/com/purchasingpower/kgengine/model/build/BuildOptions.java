package com.purchasingpower.kgengine.model.build;

import com.purchasingpower.kgengine.configuration.GraphProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options for a full knowledge graph build. Unset fields fall back to {@code app.graph.*}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildOptions {
    private Double conceptThreshold;
    private Double activityThreshold;
    private Boolean buildTopics;
    /** Embedding limit shared by the concept and activity passes. */
    private Integer limit;
    private Integer minClusterSize;
    private Double topicSimilarityThreshold;

    public static BuildOptions defaults() {
        return new BuildOptions();
    }

    /**
     * Copy with every unset field taken from the configured defaults.
     */
    public BuildOptions withDefaults(GraphProperties defaults) {
        return BuildOptions.builder()
            .conceptThreshold(conceptThreshold != null ? conceptThreshold : defaults.getConceptThreshold())
            .activityThreshold(activityThreshold != null ? activityThreshold : defaults.getActivityThreshold())
            .buildTopics(buildTopics != null ? buildTopics : defaults.isBuildTopics())
            .limit(limit != null ? limit : defaults.getBuildLimit())
            .minClusterSize(minClusterSize != null ? minClusterSize : defaults.getMinClusterSize())
            .topicSimilarityThreshold(topicSimilarityThreshold != null
                ? topicSimilarityThreshold : defaults.getTopicSimilarityThreshold())
            .build();
    }
}
