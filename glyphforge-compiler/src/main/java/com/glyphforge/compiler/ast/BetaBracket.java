package com.glyphforge.compiler.ast;

import java.util.List;

/**
 * {@code [ command modifiers = value {gammas} ]}
 */
public record BetaBracket(
    String command,
    List<String> modifiers,
    boolean assigned,
    Literal value,
    List<GammaBracket> children,
    int line
) implements AstNode {

    public BetaBracket {
        modifiers = List.copyOf(modifiers);
        children = List.copyOf(children);
    }

    public boolean hasModifier(String modifier) {
        return modifiers.contains(modifier);
    }
}
