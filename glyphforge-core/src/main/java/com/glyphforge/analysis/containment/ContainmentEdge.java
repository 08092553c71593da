package com.glyphforge.analysis.containment;

/**
 * Directed edge from a container to a component it strictly contains.
 *
 * @param score area of the contained box divided by area of the container, in (0, 1)
 */
public record ContainmentEdge(int container, int contained, double score) {
}
