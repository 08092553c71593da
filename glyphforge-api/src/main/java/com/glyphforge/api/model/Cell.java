package com.glyphforge.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A grid coordinate. {@code x} is the column, {@code y} the row.
 */
public record Cell(
    @JsonProperty("x") int x,
    @JsonProperty("y") int y
) {
}
