package com.purchasingpower.kgengine.core;

/**
 * Edge types written by the graph builders.
 *
 * <ul>
 *   <li>RELATED_TO - Concept to Concept, embedding similarity</li>
 *   <li>CONNECTS - Activity to Activity, embedding similarity</li>
 *   <li>CONTAINS - Topic to member Concept</li>
 *   <li>LEARNED_FROM - Concept to the Activity it was extracted from (written upstream)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum RelationshipType {
    RELATED_TO(true),
    CONNECTS(true),
    CONTAINS(false),
    LEARNED_FROM(false);

    private final boolean symmetric;

    RelationshipType(boolean symmetric) {
        this.symmetric = symmetric;
    }

    /**
     * Symmetric edges are stored once per unordered endpoint pair.
     */
    public boolean isSymmetric() {
        return symmetric;
    }
}
