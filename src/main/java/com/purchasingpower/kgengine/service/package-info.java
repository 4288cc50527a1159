/**
 * Graph construction and query services.
 *
 * <p>Interfaces live here, Spring implementations in {@code impl}.
 *
 * @since 1.0.0
 */
package com.purchasingpower.kgengine.service;
