package com.purchasingpower.kgengine.model.build;

import com.purchasingpower.kgengine.core.TopicNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicClusterResult {
    private int conceptsScanned;
    private int clusterableConcepts;
    private int clustersCreated;
    @Builder.Default
    private List<TopicNode> topics = new ArrayList<>();
    private long durationMs;

    public static TopicClusterResult empty(int conceptsScanned) {
        return TopicClusterResult.builder()
            .conceptsScanned(conceptsScanned)
            .build();
    }
}
