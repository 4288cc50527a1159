package com.purchasingpower.kgengine.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Defaults for graph builds and queries, bound from {@code app.graph.*}.
 */
@Data
public class GraphProperties {

    /** {@code neo4j} or {@code memory} */
    @NotBlank
    private String store = "neo4j";

    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double conceptThreshold = 0.7;

    @Min(1)
    private int conceptLimit = 100;

    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double activityThreshold = 0.75;

    @Min(1)
    private int activityLimit = 50;

    /** Used by both relationship passes of a full build. */
    @Min(1)
    private int buildLimit = 100;

    private boolean buildTopics = true;

    @Min(1)
    private int minClusterSize = 3;

    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double topicSimilarityThreshold = 0.65;

    /** Upper bound for any embedding limit; a build compares at most n*(n-1)/2 pairs. */
    @Min(2)
    private int maxEmbeddingLimit = 2000;

    @NotNull
    private TopicIdStrategy topicIdStrategy = TopicIdStrategy.SEQUENTIAL;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SchedulerProperties scheduler = new SchedulerProperties();
}
