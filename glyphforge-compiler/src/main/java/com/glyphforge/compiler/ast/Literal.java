package com.glyphforge.compiler.ast;

/**
 * A value written in source. Only unquoted identifiers are subject to scope substitution.
 */
public record Literal(String text, Kind kind) {

    public enum Kind {
        STRING,
        IDENTIFIER,
        KEYWORD
    }

    public static Literal string(String text) {
        return new Literal(text, Kind.STRING);
    }

    public static Literal identifier(String text) {
        return new Literal(text, Kind.IDENTIFIER);
    }
}
