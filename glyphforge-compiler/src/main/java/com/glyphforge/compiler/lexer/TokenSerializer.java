/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.lexer;

import java.util.List;

/**
 * Renders tokens back to single-line source text. Layout tokens are dropped, so the
 * output tokenizes to the same non-layout tokens on line 1.
 */
public final class TokenSerializer {

    private TokenSerializer() {
    }

    public static String serialize(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            if (token.kind().isLayout() || token.kind() == TokenKind.EOF) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            if (token.kind() == TokenKind.STRING) {
                char quote = token.text().indexOf('"') >= 0 ? '\'' : '"';
                sb.append(quote).append(token.text()).append(quote);
            } else {
                sb.append(token.text());
            }
        }
        return sb.toString();
    }
}
