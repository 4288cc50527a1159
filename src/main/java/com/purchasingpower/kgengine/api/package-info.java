/**
 * REST endpoints under {@code /api/v1/graph}.
 *
 * @since 1.0.0
 */
package com.purchasingpower.kgengine.api;
