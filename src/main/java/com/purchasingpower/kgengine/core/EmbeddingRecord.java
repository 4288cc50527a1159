package com.purchasingpower.kgengine.core;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A content embedding read from the vector store.
 *
 * <p>{@code ownerActivityId} is the raw activity id (without the {@code activity_} prefix).
 *
 * @since 1.0.0
 */
@Value
@Builder
public class EmbeddingRecord {
    String id;
    float[] vector;
    String ownerActivityId;
    String title;
    String sourceType;

    @Builder.Default
    Map<String, String> attributes = Map.of();

    public boolean hasOwner() {
        return ownerActivityId != null && !ownerActivityId.isBlank();
    }

    public int dimension() {
        return vector == null ? 0 : vector.length;
    }
}
