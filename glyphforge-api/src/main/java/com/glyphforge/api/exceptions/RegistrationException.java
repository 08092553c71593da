package com.glyphforge.api.exceptions;

/**
 * Thrown when a pattern or matcher cannot be registered, for example on a duplicate
 * pattern id or a matcher for an id nobody registered.
 */
public class RegistrationException extends RuntimeException {

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
