/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.registry;

import com.glyphforge.api.CustomPatternMatcher;
import com.glyphforge.api.exceptions.PatternNotFoundException;
import com.glyphforge.api.exceptions.RegistrationException;
import com.glyphforge.api.model.PatternDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Stores compiled patterns by id, in registration order, with a tag index and optional
 * custom matchers.
 *
 * <p>Registration is all-or-nothing per pattern: a rejected pattern leaves the registry
 * unchanged, and an id can never be re-registered. All methods are synchronized, so a
 * registry may be shared between compiler and matcher threads.
 */
public class PatternRegistry {
    private static final Logger logger = Logger.getLogger(PatternRegistry.class.getName());

    private final Map<String, PatternDefinition> patterns = new LinkedHashMap<>();
    private final Map<String, CustomPatternMatcher> matchers = new HashMap<>();
    private final Map<String, Set<String>> tagIndex = new HashMap<>();

    /**
     * @throws RegistrationException if a pattern with the same id exists
     */
    public synchronized void register(PatternDefinition definition) {
        if (patterns.containsKey(definition.id())) {
            throw new RegistrationException("Pattern with ID '" + definition.id() + "' already exists");
        }
        patterns.put(definition.id(), definition);
        for (String tag : definition.tags()) {
            tagIndex.computeIfAbsent(tag, t -> new LinkedHashSet<>()).add(definition.id());
        }
        logger.fine(() -> String.format("Registered %s pattern '%s' with %d rules",
            definition.kind(), definition.id(), definition.rules().size()));
    }

    /**
     * Attaches a custom matcher that replaces rule evaluation for {@code patternId}.
     *
     * @throws RegistrationException if the pattern is unknown or already has a matcher
     */
    public synchronized void registerMatcher(String patternId, CustomPatternMatcher matcher) {
        if (!patterns.containsKey(patternId)) {
            throw new RegistrationException("Cannot register matcher for unknown pattern '" + patternId + "'");
        }
        if (matchers.putIfAbsent(patternId, matcher) != null) {
            throw new RegistrationException("Matcher for pattern '" + patternId + "' already exists");
        }
    }

    /**
     * @throws PatternNotFoundException if no pattern has this id
     */
    public synchronized PatternDefinition get(String patternId) {
        PatternDefinition definition = patterns.get(patternId);
        if (definition == null) {
            throw new PatternNotFoundException("Pattern '" + patternId + "' not found");
        }
        return definition;
    }

    /**
     * @throws PatternNotFoundException if no matcher was registered for this id
     */
    public synchronized CustomPatternMatcher getMatcher(String patternId) {
        CustomPatternMatcher matcher = matchers.get(patternId);
        if (matcher == null) {
            throw new PatternNotFoundException("Matcher for pattern '" + patternId + "' not found");
        }
        return matcher;
    }

    public synchronized Optional<CustomPatternMatcher> findMatcher(String patternId) {
        return Optional.ofNullable(matchers.get(patternId));
    }

    /**
     * Ids of the patterns carrying {@code tag}, in registration order.
     *
     * @throws PatternNotFoundException if no pattern carries the tag
     */
    public synchronized Set<String> findPatternsByTag(String tag) {
        Set<String> ids = tagIndex.get(tag);
        if (ids == null) {
            throw new PatternNotFoundException("Tag '" + tag + "' not found");
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }

    public synchronized boolean contains(String patternId) {
        return patterns.containsKey(patternId);
    }

    public synchronized boolean hasTag(String tag) {
        return tagIndex.containsKey(tag);
    }

    /** All patterns in registration order. */
    public synchronized List<PatternDefinition> patterns() {
        return List.copyOf(patterns.values());
    }

    /** Track and gather patterns in registration order. */
    public synchronized List<PatternDefinition> componentPatterns() {
        List<PatternDefinition> result = new ArrayList<>();
        for (PatternDefinition definition : patterns.values()) {
            if (definition.kind().isComponentApplicable()) {
                result.add(definition);
            }
        }
        return result;
    }

    /** Relate patterns in registration order. */
    public synchronized List<PatternDefinition> relationshipPatterns() {
        List<PatternDefinition> result = new ArrayList<>();
        for (PatternDefinition definition : patterns.values()) {
            if (definition.kind().isRelationshipApplicable()) {
                result.add(definition);
            }
        }
        return result;
    }

    public synchronized int size() {
        return patterns.size();
    }

    /**
     * Independent registry holding the same patterns and matchers.
     */
    public synchronized PatternRegistry copy() {
        PatternRegistry copy = new PatternRegistry();
        for (PatternDefinition definition : patterns.values()) {
            copy.register(definition);
        }
        copy.matchers.putAll(matchers);
        return copy;
    }
}
