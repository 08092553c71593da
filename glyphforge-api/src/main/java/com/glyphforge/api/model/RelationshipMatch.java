package com.glyphforge.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A relate pattern that matched an ordered pair of components.
 *
 * @param relationship relationship kind, taken from the first passing tag rule
 */
public record RelationshipMatch(
    @JsonProperty("pattern_id") String patternId,
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("target_id") String targetId,
    @JsonProperty("relationship") String relationship,
    @JsonProperty("result") MatchResult result
) {
}
