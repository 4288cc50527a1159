package com.purchasingpower.kgengine.similarity;

import com.google.common.base.Preconditions;
import com.purchasingpower.kgengine.exception.DimensionMismatchException;

/**
 * Cosine similarity over embedding vectors.
 *
 * @since 1.0.0
 */
public final class SimilarityEngine {

    private SimilarityEngine() {
    }

    /**
     * Cosine similarity of two vectors of equal length.
     *
     * @return a value in [-1, 1]; 0 when either vector has zero norm
     * @throws DimensionMismatchException if the lengths differ
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        Preconditions.checkNotNull(a, "First vector must not be null");
        Preconditions.checkNotNull(b, "Second vector must not be null");
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dotProduct += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }

        double denominator = Math.sqrt(normA) * Math.sqrt(normB);
        if (denominator == 0.0) {
            return 0.0;
        }
        // Rounding can push |cos| slightly past 1
        return Math.max(-1.0, Math.min(1.0, dotProduct / denominator));
    }
}
