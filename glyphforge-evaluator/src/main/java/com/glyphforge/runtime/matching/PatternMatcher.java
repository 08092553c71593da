/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.runtime.matching;

import com.glyphforge.api.CustomPatternMatcher;
import com.glyphforge.api.IComponentMatcher;
import com.glyphforge.api.model.ComponentPair;
import com.glyphforge.api.model.ComponentView;
import com.glyphforge.api.model.MatchResult;
import com.glyphforge.api.model.PatternDefinition;
import com.glyphforge.api.model.PatternKind;
import com.glyphforge.api.model.PatternMatch;
import com.glyphforge.api.model.RelationshipMatch;
import com.glyphforge.api.model.Rule;
import com.glyphforge.api.model.RuleCommand;
import com.glyphforge.compiler.registry.PatternRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scores registered patterns against components and component pairs.
 *
 * <h2>Scoring</h2>
 * <p>A pattern's confidence is the fraction of its applicable rules that pass. A pattern
 * without applicable rules has confidence 0. It matches when the confidence exceeds
 * {@link MatchResult#MATCH_THRESHOLD}. A custom matcher registered for the pattern id
 * replaces rule evaluation entirely.
 *
 * <p>The UI role reported for a track pattern is the tag of its first passing tag rule.
 * Gather patterns extract properties and report no role.
 *
 * <p>Scoring never throws: a failing custom matcher is logged and treated as no match.
 */
public class PatternMatcher implements IComponentMatcher {

    private static final Logger logger = Logger.getLogger(PatternMatcher.class.getName());

    private static final Comparator<PatternMatch> BY_CONFIDENCE_DESC =
        Comparator.comparingDouble(PatternMatch::confidence).reversed();

    private final PatternRegistry registry;
    private final ComponentRuleEvaluator ruleEvaluator;
    private final PairRuleEvaluator pairEvaluator;

    public PatternMatcher(PatternRegistry registry) {
        this(registry, new ComponentRuleEvaluator(), PairRuleEvaluator.tagsOnly());
    }

    public PatternMatcher(PatternRegistry registry,
                          ComponentRuleEvaluator ruleEvaluator,
                          PairRuleEvaluator pairEvaluator) {
        this.registry = registry;
        this.ruleEvaluator = ruleEvaluator;
        this.pairEvaluator = pairEvaluator;
    }

    @Override
    public List<PatternMatch> matchComponent(ComponentView component) {
        List<PatternMatch> matches = new ArrayList<>();
        for (PatternDefinition definition : registry.componentPatterns()) {
            Scored scored = score(definition, component);
            if (scored.result().matched()) {
                matches.add(new PatternMatch(definition.id(), definition.kind(), scored.uiRole(), scored.result()));
            }
        }
        // List.sort is stable: equal confidences keep registration order
        matches.sort(BY_CONFIDENCE_DESC);
        if (logger.isLoggable(Level.FINE) && !matches.isEmpty()) {
            logger.fine(String.format("Component %s matched %d patterns, top '%s' (%.2f)",
                component.id(), matches.size(), matches.get(0).patternId(), matches.get(0).confidence()));
        }
        return matches;
    }

    @Override
    public MatchResult evaluate(String patternId, ComponentView component) {
        return score(registry.get(patternId), component).result();
    }

    @Override
    public List<RelationshipMatch> matchRelationships(List<ComponentPair> pairs) {
        List<PatternDefinition> relatePatterns = registry.relationshipPatterns();
        if (relatePatterns.isEmpty() || pairs.isEmpty()) {
            return List.of();
        }
        List<RelationshipMatch> matches = new ArrayList<>();
        for (ComponentPair pair : pairs) {
            for (PatternDefinition definition : relatePatterns) {
                int applicable = 0;
                int passed = 0;
                String relationship = null;
                for (Rule rule : definition.rules()) {
                    RuleOutcome outcome = pairEvaluator.evaluate(rule, pair);
                    if (!outcome.applicable()) {
                        continue;
                    }
                    applicable++;
                    if (outcome.passed()) {
                        passed++;
                        if (relationship == null && rule.command() == RuleCommand.TAG) {
                            relationship = rule.target();
                        }
                    }
                }
                MatchResult result = applicable == 0
                    ? MatchResult.noMatch()
                    : MatchResult.of((double) passed / applicable, Map.of());
                if (result.matched()) {
                    matches.add(new RelationshipMatch(definition.id(), pair.source().id(), pair.target().id(),
                        relationship != null ? relationship : definition.id(), result));
                }
            }
        }
        return matches;
    }

    private Scored score(PatternDefinition definition, ComponentView component) {
        Optional<CustomPatternMatcher> custom = registry.findMatcher(definition.id());
        if (custom.isPresent()) {
            return new Scored(runCustom(definition.id(), custom.get(), component), roleFor(definition, null));
        }

        int applicable = 0;
        int passed = 0;
        String firstTag = null;
        Map<String, Object> properties = new LinkedHashMap<>();
        for (Rule rule : definition.rules()) {
            RuleOutcome outcome = ruleEvaluator.evaluate(rule, component);
            if (!outcome.applicable()) {
                continue;
            }
            applicable++;
            if (outcome.passed()) {
                passed++;
                properties.putAll(outcome.properties());
                if (firstTag == null && rule.command() == RuleCommand.TAG) {
                    firstTag = rule.target();
                }
            }
        }
        if (applicable == 0) {
            return new Scored(MatchResult.noMatch(), null);
        }
        return new Scored(MatchResult.of((double) passed / applicable, properties), roleFor(definition, firstTag));
    }

    private static String roleFor(PatternDefinition definition, String firstPassingTag) {
        if (definition.kind() != PatternKind.TRACK) {
            return null;
        }
        return firstPassingTag != null ? firstPassingTag : definition.id();
    }

    private static MatchResult runCustom(String patternId, CustomPatternMatcher matcher, ComponentView component) {
        try {
            MatchResult result = matcher.match(component);
            return result != null ? result : MatchResult.noMatch();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Custom matcher for pattern '" + patternId + "' failed", e);
            return MatchResult.noMatch();
        }
    }

    private record Scored(MatchResult result, String uiRole) {
    }
}
