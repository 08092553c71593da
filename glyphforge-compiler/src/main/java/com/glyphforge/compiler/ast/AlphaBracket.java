package com.glyphforge.compiler.ast;

import java.util.List;

/**
 * Top-level statement {@code < command modifiers : target [betas] >} with an optional
 * EXEC clause ({@code exec} is null when absent).
 */
public record AlphaBracket(
    String command,
    List<String> modifiers,
    boolean bridged,
    String bridgeTarget,
    List<BetaBracket> children,
    ExecClause exec,
    int line
) implements AstNode {

    public AlphaBracket {
        modifiers = List.copyOf(modifiers);
        children = List.copyOf(children);
    }

    public boolean hasModifier(String modifier) {
        return modifiers.contains(modifier);
    }
}
