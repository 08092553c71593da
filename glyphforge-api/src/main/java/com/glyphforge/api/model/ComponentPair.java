package com.glyphforge.api.model;

/**
 * Ordered pair of components considered by relationship patterns.
 */
public record ComponentPair(ComponentView source, ComponentView target) {
}
