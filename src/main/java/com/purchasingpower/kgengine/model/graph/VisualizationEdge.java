package com.purchasingpower.kgengine.model.graph;

import com.purchasingpower.kgengine.core.GraphRelationship;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisualizationEdge {
    private String source;
    private String target;
    private String type;
    private Map<String, Object> properties;

    public static VisualizationEdge of(GraphRelationship relationship) {
        return VisualizationEdge.builder()
            .source(relationship.from().id())
            .target(relationship.to().id())
            .type(relationship.type())
            .properties(relationship.properties())
            .build();
    }
}
