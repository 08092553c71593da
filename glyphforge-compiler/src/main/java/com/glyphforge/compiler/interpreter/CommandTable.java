/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.interpreter;

import com.glyphforge.api.exceptions.DslFatalException;
import com.glyphforge.compiler.ast.AstNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Command name to handler map for one bracket level.
 */
final class CommandTable<N extends AstNode, R> {

    private final String level;
    private final Map<String, CommandHandler<N, R>> handlers = new LinkedHashMap<>();

    CommandTable(String level) {
        this.level = level;
    }

    /**
     * @throws IllegalStateException if the command is already registered
     */
    CommandTable<N, R> register(String command, CommandHandler<N, R> handler) {
        if (handlers.putIfAbsent(command, handler) != null) {
            throw new IllegalStateException("Duplicate " + level + " command '" + command + "'");
        }
        return this;
    }

    R dispatch(InterpretationRun run, N node, Scope scope) {
        CommandHandler<N, R> handler = handlers.get(node.command());
        if (handler == null) {
            throw new DslFatalException("Unknown " + level + " command '" + node.command() + "'", node.line());
        }
        return handler.handle(run, node, scope);
    }

    Set<String> commands() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
