package com.purchasingpower.kgengine.model.build;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param running   a build is in flight
 * @param scheduled a periodic task is installed
 */
public record SchedulerStatus(
    @JsonProperty("isRunning") boolean running,
    @JsonProperty("isScheduled") boolean scheduled) {
}
