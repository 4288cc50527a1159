package com.purchasingpower.kgengine.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class SchedulerProperties {

    /** Start periodic builds once the application is ready. */
    private boolean enabled = true;

    @Min(1000)
    private long intervalMs = 1_800_000L;
}
