package com.purchasingpower.kgengine.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Emergent topic created by the topic clusterer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicNode {
    private String id;
    private String name;
    private List<String> memberConceptIds;
}
