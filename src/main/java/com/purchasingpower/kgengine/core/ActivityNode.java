package com.purchasingpower.kgengine.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Activity as stored in the graph; written upstream by ingestion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityNode {
    private String id;
    private String title;
    private String sourceType;
    private String url;
    private Object timestamp;

    public static ActivityNode from(GraphNode node) {
        String sourceType = node.stringProperty("sourceType");
        return ActivityNode.builder()
            .id(node.id())
            .title(node.stringProperty("title") != null ? node.stringProperty("title") : node.stringProperty("name"))
            .sourceType(sourceType != null ? sourceType : node.stringProperty("source_type"))
            .url(node.stringProperty("url"))
            .timestamp(node.property("timestamp"))
            .build();
    }
}
