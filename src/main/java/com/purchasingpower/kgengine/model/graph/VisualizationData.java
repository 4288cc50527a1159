package com.purchasingpower.kgengine.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Payload for the graph view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisualizationData {
    private List<VisualizationNode> nodes;
    private List<VisualizationEdge> edges;
    private List<TopicSummary> topics;
    private VisualizationStats stats;

    public static VisualizationData empty() {
        return VisualizationData.builder()
            .nodes(List.of())
            .edges(List.of())
            .topics(List.of())
            .stats(new VisualizationStats(0, 0, 0))
            .build();
    }

    public static VisualizationData of(GraphSnapshot snapshot, List<TopicSummary> topics) {
        return VisualizationData.builder()
            .nodes(snapshot.getNodes())
            .edges(snapshot.getEdges())
            .topics(topics)
            .stats(new VisualizationStats(snapshot.getNodes().size(), snapshot.getEdges().size(), topics.size()))
            .build();
    }
}
