package com.glyphforge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directed, named relationship from the owning component to {@code targetId}.
 */
public record ComponentRelationship(
    @JsonProperty("kind") String kind,
    @JsonProperty("target") String targetId
) {
}
