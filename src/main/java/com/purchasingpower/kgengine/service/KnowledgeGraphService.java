package com.purchasingpower.kgengine.service;

import com.purchasingpower.kgengine.model.build.BuildOptions;
import com.purchasingpower.kgengine.model.build.GraphStatistics;
import com.purchasingpower.kgengine.model.build.KnowledgeGraphBuildResult;

/**
 * Runs full builds: concept relationships, then activity relationships, then topics.
 *
 * <p>Callers are responsible for single-flight; see {@link GraphBuildScheduler}.
 *
 * @since 1.0.0
 */
public interface KnowledgeGraphService {

    KnowledgeGraphBuildResult buildKnowledgeGraph(BuildOptions options);

    GraphStatistics getGraphStatistics();
}
