/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.lexer;

/**
 * Token categories of the pattern DSL.
 */
public enum TokenKind {
    ALPHA_OPEN("<"),
    ALPHA_CLOSE(">"),
    BETA_OPEN("["),
    BETA_CLOSE("]"),
    GAMMA_OPEN("{"),
    GAMMA_CLOSE("}"),
    DELTA_OPEN("("),
    DELTA_CLOSE(")"),
    ASSIGN("="),
    BRIDGE(":"),
    COMMA(","),
    CHAIN("@@"),
    IDENTIFIER(null),
    KEYWORD(null),
    STRING(null),
    CHAR(null),
    INDENT(null),
    DEDENT(null),
    EOF(null);

    private final String symbol;

    TokenKind(String symbol) {
        this.symbol = symbol;
    }

    /** Fixed source text of punctuation tokens, null for the others. */
    public String symbol() {
        return symbol;
    }

    public boolean isName() {
        return this == IDENTIFIER || this == KEYWORD;
    }

    public boolean isValue() {
        return this == IDENTIFIER || this == KEYWORD || this == STRING;
    }

    public boolean isOpeningBracket() {
        return this == ALPHA_OPEN || this == BETA_OPEN || this == GAMMA_OPEN || this == DELTA_OPEN;
    }

    public boolean isClosingBracket() {
        return this == ALPHA_CLOSE || this == BETA_CLOSE || this == GAMMA_CLOSE || this == DELTA_CLOSE;
    }

    public boolean isLayout() {
        return this == INDENT || this == DEDENT;
    }
}
