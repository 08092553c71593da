package com.glyphforge.compiler.ast;

import java.util.List;

/**
 * {@code ( command value, value ... )}
 */
public record DeltaBracket(String command, List<Literal> values, int line) implements AstNode {

    public DeltaBracket {
        values = List.copyOf(values);
    }
}
