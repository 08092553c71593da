/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.interpreter;

import com.glyphforge.api.model.Rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a bracket contributes to its enclosing pattern: rules and named parameters.
 * Mutable accumulator, merged bottom-up.
 */
final class Evaluation {

    private final List<Rule> rules = new ArrayList<>();
    private final Map<String, List<String>> params = new LinkedHashMap<>();

    static Evaluation empty() {
        return new Evaluation();
    }

    static Evaluation ofRule(Rule rule) {
        Evaluation evaluation = new Evaluation();
        evaluation.rules.add(rule);
        return evaluation;
    }

    Evaluation addParam(String name, List<String> values) {
        params.computeIfAbsent(name, n -> new ArrayList<>()).addAll(values);
        return this;
    }

    Evaluation merge(Evaluation other) {
        rules.addAll(other.rules);
        other.params.forEach(this::addParam);
        return this;
    }

    List<Rule> rules() {
        return Collections.unmodifiableList(rules);
    }

    Map<String, List<String>> params() {
        return Collections.unmodifiableMap(params);
    }
}
