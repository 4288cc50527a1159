package com.purchasingpower.kgengine.model.graph;

import com.google.common.base.Preconditions;

/**
 * @param limit             maximum number of relationships read
 * @param includeActivities keep edges touching Activity nodes
 * @param includeTopics     attach the topic listing
 * @param minNodeDegree     nodes with a lower degree are dropped
 */
public record VisualizationOptions(int limit, boolean includeActivities, boolean includeTopics, int minNodeDegree) {

    public static final int DEFAULT_LIMIT = 200;

    public VisualizationOptions {
        Preconditions.checkArgument(limit >= 1, "limit must be >= 1, got %s", limit);
        Preconditions.checkArgument(minNodeDegree >= 0, "minNodeDegree must be >= 0, got %s", minNodeDegree);
    }

    public static VisualizationOptions defaults() {
        return new VisualizationOptions(DEFAULT_LIMIT, true, true, 1);
    }
}
