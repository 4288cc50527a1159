package com.purchasingpower.kgengine.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisualizationNode {
    private String id;
    private String label;
    private String type;
    private Map<String, Object> properties;
    private int degree;
}
