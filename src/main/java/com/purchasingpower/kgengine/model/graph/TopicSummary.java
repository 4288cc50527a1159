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
public class TopicSummary {
    private String id;
    private String name;
    private List<String> concepts;
    private int conceptCount;
}
