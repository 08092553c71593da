package com.glyphforge.compiler.ast;

import java.util.List;

/**
 * Parsed pattern source: one or more statements in source order.
 */
public record Program(List<AlphaBracket> statements) {

    public Program {
        statements = List.copyOf(statements);
    }
}
