/**
 * Graph domain types: node labels, edge types, id conventions and the
 * records read back from the graph and vector stores.
 *
 * @since 1.0.0
 */
package com.purchasingpower.kgengine.core;
