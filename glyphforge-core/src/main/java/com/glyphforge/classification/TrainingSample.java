package com.glyphforge.classification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One labelled ASCII snippet. Every non-whitespace character of {@code lines} belongs
 * to the sample component.
 */
public record TrainingSample(
    @JsonProperty("label") String label,
    @JsonProperty("lines") List<String> lines
) {
}
