package com.glyphforge.api;

import com.glyphforge.api.model.ComponentView;
import com.glyphforge.api.model.MatchResult;

/**
 * Matcher registered against a pattern id, replacing rule evaluation for that pattern.
 */
@FunctionalInterface
public interface CustomPatternMatcher {

    MatchResult match(ComponentView component);
}
