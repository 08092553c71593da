/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.interpreter;

import com.glyphforge.api.model.DslWarning;

import java.util.List;

/**
 * Patterns registered, warnings raised and per-statement evaluations of one program.
 * {@code statements} follows source order.
 */
public record InterpretationResult(
    List<String> patternIds,
    List<DslWarning> warnings,
    List<StatementResult> statements
) {

    public InterpretationResult {
        patternIds = List.copyOf(patternIds);
        warnings = List.copyOf(warnings);
        statements = List.copyOf(statements);
    }
}
