/**
 * Store abstractions: the graph store with its named queries and the vector store.
 *
 * <p>Implementations live in the {@code impl} subpackage.
 *
 * @since 1.0.0
 */
package com.purchasingpower.kgengine.knowledge;
