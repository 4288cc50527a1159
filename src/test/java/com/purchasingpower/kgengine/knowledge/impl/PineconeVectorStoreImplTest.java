package com.purchasingpower.kgengine.knowledge.impl;

import com.google.protobuf.Value;
import com.purchasingpower.kgengine.core.EmbeddingRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@DisplayName("Pinecone vector conversion")
class PineconeVectorStoreImplTest {

    @Test
    @DisplayName("Metadata maps to owner, title and source type")
    void metadataMapping() {
        // Given
        Map<String, Value> metadata = Map.of(
            "activity_id", Value.newBuilder().setStringValue("17").build(),
            "title", Value.newBuilder().setStringValue("Intro to graphs").build(),
            "source_type", Value.newBuilder().setStringValue("pdf").build(),
            "page", Value.newBuilder().setNumberValue(3).build());

        // When
        EmbeddingRecord record = PineconeVectorStoreImpl.toRecord("embedding_17", List.of(0.5f, -0.25f), metadata);

        // Then
        assertEquals("embedding_17", record.getId());
        assertArrayEquals(new float[]{0.5f, -0.25f}, record.getVector());
        assertEquals("17", record.getOwnerActivityId());
        assertEquals("Intro to graphs", record.getTitle());
        assertEquals("pdf", record.getSourceType());
        assertThat(record.getAttributes()).containsEntry("page", "3");
    }

    @Test
    @DisplayName("Numeric activity ids are read without a decimal part")
    void numericActivityId() {
        Map<String, Value> metadata = Map.of("activity_id", Value.newBuilder().setNumberValue(42).build());

        EmbeddingRecord record = PineconeVectorStoreImpl.toRecord("e", List.of(1f), metadata);

        assertEquals("42", record.getOwnerActivityId());
    }

    @Test
    @DisplayName("Records without activity_id have no owner")
    void missingOwner() {
        EmbeddingRecord record = PineconeVectorStoreImpl.toRecord("e", List.of(1f), Map.of());

        assertFalse(record.hasOwner());
    }
}
