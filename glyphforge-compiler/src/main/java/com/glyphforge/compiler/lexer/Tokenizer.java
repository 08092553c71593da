/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts pattern DSL source into tokens.
 *
 * <p>Lexing is line oriented:
 * <ul>
 *   <li>blank lines and lines whose first visible character is {@code #} produce nothing
 *       and leave the indentation level unchanged</li>
 *   <li>the count of leading whitespace characters is the line's indentation; a change
 *       emits one INDENT or DEDENT per {@value #INDENT_WIDTH} columns of difference</li>
 *   <li>a letter or underscore starts a word that becomes a KEYWORD if reserved and an
 *       IDENTIFIER otherwise</li>
 *   <li>quoted strings use either quote character without escapes; an unterminated string
 *       runs to the end of the line</li>
 *   <li>any other character that is not whitespace becomes a CHAR token</li>
 * </ul>
 * Pending indentation is closed with DEDENT tokens before the final EOF.
 *
 * <p>Tokenizing never fails; grammar errors are reported by the parser.
 */
public final class Tokenizer {

    public static final int INDENT_WIDTH = 4;

    public static final Set<String> KEYWORDS = Set.of(
        "hunt", "INIT", "param", "val", "EXEC", "Track", "GATHER", "GET", "HARVEST", "HARV",
        "RACK", "COOK", "tag", "pluck", "trap", "skin", "log", "boil", "scent", "snare",
        "true", "false", "req", "prohib");

    public List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        String[] lines = source.split("\r?\n", -1);
        int currentIndent = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNumber = i + 1;
            String content = line.strip();
            if (content.isEmpty() || content.charAt(0) == '#') {
                continue;
            }

            int indent = leadingWhitespace(line);
            if (indent > currentIndent) {
                for (int n = 0; n < (indent - currentIndent) / INDENT_WIDTH; n++) {
                    tokens.add(new Token(TokenKind.INDENT, "", lineNumber));
                }
            } else if (indent < currentIndent) {
                for (int n = 0; n < (currentIndent - indent) / INDENT_WIDTH; n++) {
                    tokens.add(new Token(TokenKind.DEDENT, "", lineNumber));
                }
            }
            currentIndent = indent;

            lexLine(content, lineNumber, tokens);
        }

        int lastLine = Math.max(1, lines.length);
        for (int n = 0; n < currentIndent / INDENT_WIDTH; n++) {
            tokens.add(new Token(TokenKind.DEDENT, "", lastLine));
        }
        tokens.add(new Token(TokenKind.EOF, "", lastLine));
        return tokens;
    }

    private static int leadingWhitespace(String line) {
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            count++;
        }
        return count;
    }

    private static void lexLine(String line, int lineNumber, List<Token> tokens) {
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            TokenKind single = punctuation(c);
            if (single != null) {
                tokens.add(new Token(single, String.valueOf(c), lineNumber));
                i++;
            } else if (c == '@' && i + 1 < line.length() && line.charAt(i + 1) == '@') {
                tokens.add(new Token(TokenKind.CHAIN, "@@", lineNumber));
                i += 2;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < line.length() && (Character.isLetterOrDigit(line.charAt(i)) || line.charAt(i) == '_')) {
                    i++;
                }
                String word = line.substring(start, i);
                tokens.add(new Token(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER,
                    word, lineNumber));
            } else if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '"' || c == '\'') {
                int end = line.indexOf(c, i + 1);
                if (end < 0) {
                    tokens.add(new Token(TokenKind.STRING, line.substring(i + 1), lineNumber));
                    i = line.length();
                } else {
                    tokens.add(new Token(TokenKind.STRING, line.substring(i + 1, end), lineNumber));
                    i = end + 1;
                }
            } else {
                tokens.add(new Token(TokenKind.CHAR, String.valueOf(c), lineNumber));
                i++;
            }
        }
    }

    private static TokenKind punctuation(char c) {
        return switch (c) {
            case '<' -> TokenKind.ALPHA_OPEN;
            case '>' -> TokenKind.ALPHA_CLOSE;
            case '[' -> TokenKind.BETA_OPEN;
            case ']' -> TokenKind.BETA_CLOSE;
            case '{' -> TokenKind.GAMMA_OPEN;
            case '}' -> TokenKind.GAMMA_CLOSE;
            case '(' -> TokenKind.DELTA_OPEN;
            case ')' -> TokenKind.DELTA_CLOSE;
            case '=' -> TokenKind.ASSIGN;
            case ':' -> TokenKind.BRIDGE;
            case ',' -> TokenKind.COMMA;
            default -> null;
        };
    }
}
