package com.purchasingpower.kgengine.exception;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * Error body returned by the REST API.
 */
@Getter
@Builder
public class ApiError {

    public static final String VALIDATION_ERROR = "VALIDATION_001";
    public static final String CONCEPT_NOT_FOUND = "GRAPH_001";
    public static final String GRAPH_STORE_UNAVAILABLE = "GRAPH_002";
    public static final String VECTOR_STORE_UNAVAILABLE = "VECTOR_001";
    public static final String INTERNAL_ERROR = "INTERNAL_001";

    /** Also written to the log, for correlation. */
    private final String errorId;
    private final String code;
    private final String message;
    private final Instant timestamp;
    private final String path;
}
