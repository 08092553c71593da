/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.interpreter;

import com.glyphforge.compiler.ast.AstNode;

/**
 * Evaluates one bracket command.
 */
@FunctionalInterface
interface CommandHandler<N extends AstNode, R> {

    R handle(InterpretationRun run, N node, Scope scope);
}
