package com.glyphforge.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A successful match of a registered pattern against a component.
 *
 * @param uiRole the role implied by the first passing tag rule, or null if none
 */
public record PatternMatch(
    @JsonProperty("pattern_id") String patternId,
    @JsonProperty("kind") PatternKind kind,
    @JsonProperty("ui_role") String uiRole,
    @JsonProperty("result") MatchResult result
) {

    public double confidence() {
        return result.confidence();
    }
}
