package com.glyphforge.api.exceptions;

/**
 * Thrown when a pattern id, matcher or tag is looked up but was never registered.
 */
public class PatternNotFoundException extends RuntimeException {

    public PatternNotFoundException(String message) {
        super(message);
    }
}
