package com.purchasingpower.kgengine.configuration;

/**
 * How topic ids are assigned.
 */
public enum TopicIdStrategy {
    /** topic_1, topic_2, ... numbered per run */
    SEQUENTIAL,
    /** topic_ + SHA-256 prefix of the sorted member concept ids, stable across runs */
    CONTENT_HASH
}
