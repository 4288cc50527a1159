package com.purchasingpower.kgengine.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Concept as stored in the graph; written upstream by concept extraction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConceptNode {
    private String id;
    private String name;
    private String label;
    private Double confidence;

    public static ConceptNode from(GraphNode node) {
        Object confidence = node.property("confidence");
        return ConceptNode.builder()
            .id(node.id())
            .name(node.stringProperty("name"))
            .label(node.stringProperty("label"))
            .confidence(confidence instanceof Number n ? n.doubleValue() : null)
            .build();
    }
}
