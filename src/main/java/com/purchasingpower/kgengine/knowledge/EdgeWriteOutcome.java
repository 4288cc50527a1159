package com.purchasingpower.kgengine.knowledge;

/**
 * Result of an idempotent edge write. An existing edge of the same type between the
 * same endpoints is reported, not thrown.
 */
public enum EdgeWriteOutcome {
    CREATED,
    ALREADY_EXISTS
}
