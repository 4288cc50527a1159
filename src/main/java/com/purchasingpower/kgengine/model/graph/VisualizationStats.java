package com.purchasingpower.kgengine.model.graph;

public record VisualizationStats(int nodeCount, int edgeCount, int topicCount) {
}
