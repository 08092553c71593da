package com.glyphforge.compiler.ast;

import java.util.List;

/**
 * {@code { command modifiers : target = value (deltas) }}
 *
 * @param bridged  a {@code :} was present; {@code bridgeTarget} may still be null when the
 *                 target was omitted
 * @param assigned a {@code =} was present; {@code value} may still be null
 */
public record GammaBracket(
    String command,
    List<String> modifiers,
    boolean bridged,
    String bridgeTarget,
    boolean assigned,
    Literal value,
    List<DeltaBracket> children,
    int line
) implements AstNode {

    public GammaBracket {
        modifiers = List.copyOf(modifiers);
        children = List.copyOf(children);
    }

    public boolean hasModifier(String modifier) {
        return modifiers.contains(modifier);
    }
}
