package com.purchasingpower.kgengine.exception;

/**
 * The vector store could not be read. Aborts the build pass that needed the embeddings.
 */
public class EmbeddingRetrievalException extends RuntimeException {

    public EmbeddingRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
