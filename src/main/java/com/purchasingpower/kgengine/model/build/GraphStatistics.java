package com.purchasingpower.kgengine.model.build;

import com.purchasingpower.kgengine.knowledge.GraphStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStatistics {
    private Map<String, Long> nodes;
    private Map<String, Long> relationships;
    private long totalNodes;
    private long totalRelationships;

    public static GraphStatistics from(GraphStats stats) {
        return GraphStatistics.builder()
            .nodes(stats.nodes())
            .relationships(stats.relationships())
            .totalNodes(stats.totalNodes())
            .totalRelationships(stats.totalRelationships())
            .build();
    }
}
