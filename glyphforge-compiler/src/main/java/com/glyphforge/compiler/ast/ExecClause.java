package com.glyphforge.compiler.ast;

import java.util.List;

/**
 * The {@code EXEC} trailer of a statement.
 */
public record ExecClause(List<ExecParam> params, int line) {

    public ExecClause {
        params = List.copyOf(params);
    }
}
