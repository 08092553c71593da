/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.interpreter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lexical variable scope. Lookups fall back to the parent chain; definitions always go
 * into this scope and shadow outer ones.
 */
public final class Scope {

    private final Scope parent;
    private final Map<String, String> values = new HashMap<>();

    public Scope() {
        this(null);
    }

    private Scope(Scope parent) {
        this.parent = parent;
    }

    public Scope child() {
        return new Scope(this);
    }

    public void define(String name, String value) {
        values.put(name, value);
    }

    public Optional<String> lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            String value = scope.values.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public boolean isSet(String flag) {
        return lookup(flag).map(Boolean::parseBoolean).orElse(false);
    }
}
