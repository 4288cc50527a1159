package com.purchasingpower.kgengine.model.build;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response to a manual build request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BuildTriggerResult {

    public static final String ALREADY_IN_PROGRESS = "Graph build already in progress";

    private boolean success;
    private String message;
    private KnowledgeGraphBuildResult results;
    private String error;

    public static BuildTriggerResult success(KnowledgeGraphBuildResult results) {
        return BuildTriggerResult.builder()
            .success(true)
            .message("Graph build completed")
            .results(results)
            .build();
    }

    public static BuildTriggerResult alreadyRunning() {
        return BuildTriggerResult.builder()
            .success(false)
            .message(ALREADY_IN_PROGRESS)
            .build();
    }

    public static BuildTriggerResult error(String error) {
        return BuildTriggerResult.builder()
            .success(false)
            .error(error)
            .build();
    }
}
