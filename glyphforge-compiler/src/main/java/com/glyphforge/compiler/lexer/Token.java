/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.lexer;

/**
 * A lexical token. For {@link TokenKind#STRING} the text is the unquoted literal.
 *
 * @param line 1-based source line
 */
public record Token(TokenKind kind, String text, int line) {

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + line;
    }
}
