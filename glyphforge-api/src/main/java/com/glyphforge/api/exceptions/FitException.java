/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.api.exceptions;

/**
 * Thrown by the classifier when it is used before training or trained on unusable data.
 */
public class FitException extends RuntimeException {

    public FitException(String message) {
        super(message);
    }

    public FitException(String message, Throwable cause) {
        super(message, cause);
    }
}
