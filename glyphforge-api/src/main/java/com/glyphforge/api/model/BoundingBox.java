/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inclusive rectangle of grid cells occupied by a component.
 *
 * <p>Width and height count cells, so a single cell has width and height 1.
 */
public record BoundingBox(
    @JsonProperty("x_min") int xMin,
    @JsonProperty("y_min") int yMin,
    @JsonProperty("x_max") int xMax,
    @JsonProperty("y_max") int yMax
) {

    public BoundingBox {
        if (xMax < xMin || yMax < yMin) {
            throw new IllegalArgumentException(String.format(
                "Invalid bounding box: (%d,%d)-(%d,%d)", xMin, yMin, xMax, yMax));
        }
    }

    @JsonIgnore
    public int width() {
        return xMax - xMin + 1;
    }

    @JsonIgnore
    public int height() {
        return yMax - yMin + 1;
    }

    @JsonIgnore
    public int area() {
        return width() * height();
    }

    /**
     * Returns true if {@code other} lies strictly inside this box on all four sides.
     * A box never strictly contains itself.
     */
    public boolean strictlyContains(BoundingBox other) {
        return xMin < other.xMin && yMin < other.yMin
            && xMax > other.xMax && yMax > other.yMax;
    }

    public boolean contains(int x, int y) {
        return x >= xMin && x <= xMax && y >= yMin && y <= yMax;
    }

    /** True when the row ranges of the two boxes share at least one row. */
    public boolean overlapsVertically(BoundingBox other) {
        return yMin <= other.yMax && other.yMin <= yMax;
    }

    /** True when the column ranges of the two boxes share at least one column. */
    public boolean overlapsHorizontally(BoundingBox other) {
        return xMin <= other.xMax && other.xMin <= xMax;
    }
}
