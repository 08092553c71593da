/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.interpreter;

import com.glyphforge.api.model.Rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rules and parameters one top-level statement evaluated to, EXEC options included.
 * Patterns the statement registered carry the same values.
 */
public record StatementResult(String command, int line, List<Rule> rules, Map<String, List<String>> params) {

    public StatementResult {
        rules = List.copyOf(rules);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        params.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        params = Collections.unmodifiableMap(copy);
    }

    static StatementResult of(String command, int line, Evaluation evaluation) {
        return new StatementResult(command, line, evaluation.rules(), evaluation.params());
    }

    /**
     * Values of a parameter, or an empty list when the statement did not set it.
     */
    public List<String> param(String name) {
        return params.getOrDefault(name, List.of());
    }
}
