package com.purchasingpower.kgengine.knowledge;

import com.purchasingpower.kgengine.core.EmbeddingRecord;
import com.purchasingpower.kgengine.exception.EmbeddingRetrievalException;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to stored content embeddings.
 *
 * @since 1.0.0
 */
public interface VectorStore {

    /**
     * @throws EmbeddingRetrievalException if the store cannot be read
     */
    List<EmbeddingRecord> getAllEmbeddings(int limit);

    Optional<EmbeddingRecord> getEmbeddingById(String id);
}
