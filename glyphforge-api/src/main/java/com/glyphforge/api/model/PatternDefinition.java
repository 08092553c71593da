/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named, immutable pattern produced by the DSL interpreter.
 *
 * <p>Tags are derived from the targets of the pattern's tag rules, in rule order.
 *
 * @param id          unique pattern id
 * @param kind        track, gather or relate
 * @param rules       ordered rules
 * @param options     free-form execution options ({@code name=value} pairs)
 * @param required    a recognition run with no matching component emits a warning
 * @param prohibited  every matching component emits a warning
 */
public record PatternDefinition(
    @JsonProperty("id") String id,
    @JsonProperty("kind") PatternKind kind,
    @JsonProperty("rules") List<Rule> rules,
    @JsonProperty("options") Map<String, String> options,
    @JsonProperty("required") boolean required,
    @JsonProperty("prohibited") boolean prohibited
) {

    public PatternDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        rules = rules == null ? List.of() : List.copyOf(rules);
        options = options == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static PatternDefinition of(String id, PatternKind kind, List<Rule> rules) {
        return new PatternDefinition(id, kind, rules, Map.of(), false, false);
    }

    /**
     * Tag names of this pattern, in first-seen order.
     */
    public Set<String> tags() {
        Set<String> tags = new LinkedHashSet<>();
        for (Rule rule : rules) {
            if (rule.command() == RuleCommand.TAG) {
                tags.add(rule.target());
            }
        }
        return Collections.unmodifiableSet(tags);
    }

    /**
     * All literals of all tag rules, used for overlap analysis.
     */
    public Set<String> tagLiterals() {
        Set<String> literals = new LinkedHashSet<>();
        for (Rule rule : rules) {
            if (rule.command() == RuleCommand.TAG) {
                literals.addAll(rule.values());
            }
        }
        return Collections.unmodifiableSet(literals);
    }
}
