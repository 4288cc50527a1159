package com.purchasingpower.kgengine.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeSubgraph {
    private String centerNodeId;
    private List<VisualizationNode> nodes;
    private List<VisualizationEdge> edges;
}
