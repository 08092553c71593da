/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.api.exceptions;

/**
 * Thrown when pattern DSL source does not follow the bracket grammar.
 *
 * <p>Carries the token kind the parser expected, the kind it actually found and
 * the 1-based source line of the offending token.
 */
public class ParseException extends RuntimeException {

    private final String expected;
    private final String actual;
    private final int line;

    public ParseException(String expected, String actual, int line) {
        super(String.format("Expected %s but found %s at line %d", expected, actual, line));
        this.expected = expected;
        this.actual = actual;
        this.line = line;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }

    public int getLine() {
        return line;
    }
}
