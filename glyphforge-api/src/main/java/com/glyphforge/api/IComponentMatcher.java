package com.glyphforge.api;

import com.glyphforge.api.model.ComponentPair;
import com.glyphforge.api.model.ComponentView;
import com.glyphforge.api.model.MatchResult;
import com.glyphforge.api.model.PatternMatch;
import com.glyphforge.api.model.RelationshipMatch;

import java.util.List;

/**
 * Contract for applying registered patterns to discovered components.
 */
public interface IComponentMatcher {

    /**
     * Evaluates every component-level pattern against the component.
     *
     * @return matching patterns only, sorted by descending confidence; ties keep
     *         registration order
     */
    List<PatternMatch> matchComponent(ComponentView component);

    /**
     * Evaluates a single pattern, matched or not.
     *
     * @throws com.glyphforge.api.exceptions.PatternNotFoundException for an unknown id
     */
    MatchResult evaluate(String patternId, ComponentView component);

    /**
     * Evaluates relate patterns against each ordered pair.
     */
    List<RelationshipMatch> matchRelationships(List<ComponentPair> pairs);
}
