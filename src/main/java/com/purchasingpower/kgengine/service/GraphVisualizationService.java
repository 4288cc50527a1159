package com.purchasingpower.kgengine.service;

import com.purchasingpower.kgengine.model.graph.ConceptDetails;
import com.purchasingpower.kgengine.model.graph.NodeSubgraph;
import com.purchasingpower.kgengine.model.graph.TopicSummary;
import com.purchasingpower.kgengine.model.graph.VisualizationData;
import com.purchasingpower.kgengine.model.graph.VisualizationOptions;

import java.util.List;
import java.util.Optional;

/**
 * Read-only views of the graph. Safe to call while a build is running.
 *
 * @since 1.0.0
 */
public interface GraphVisualizationService {

    /**
     * Degree-filtered nodes and edges plus the topic listing. Returns an empty payload
     * when the graph cannot be read.
     */
    VisualizationData getVisualizationData(VisualizationOptions options);

    List<TopicSummary> getTopicData();

    /**
     * @return empty if no Concept with that name exists
     */
    Optional<ConceptDetails> getConceptDetails(String conceptName, int limit);

    NodeSubgraph getNodeSubgraph(String nodeId, int depth, int limit);
}
