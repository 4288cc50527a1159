/**
 * Pure similarity functions with no store access.
 *
 * @since 1.0.0
 */
package com.purchasingpower.kgengine.similarity;
