/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.interpreter;

import com.glyphforge.api.WarningSink;
import com.glyphforge.compiler.ast.AlphaBracket;
import com.glyphforge.compiler.ast.Program;
import com.glyphforge.compiler.registry.PatternRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Walks a parsed program and registers the patterns it declares.
 *
 * <p>Statements run in source order against one root scope. Registration failures and
 * fatal directives propagate; patterns registered before the failure stay registered.
 * Trap failures are warnings unless {@code fatalTraps} is set.
 */
public class HuntInterpreter {

    private static final Logger logger = Logger.getLogger(HuntInterpreter.class.getName());

    private final PatternRegistry registry;
    private final WarningSink sink;
    private final boolean fatalTraps;

    public HuntInterpreter(PatternRegistry registry, WarningSink sink, boolean fatalTraps) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sink = sink == null ? WarningSink.discarding() : sink;
        this.fatalTraps = fatalTraps;
    }

    public HuntInterpreter(PatternRegistry registry) {
        this(registry, WarningSink.discarding(), false);
    }

    public InterpretationResult interpret(Program program) {
        InterpretationRun run = new InterpretationRun(registry, sink, fatalTraps);
        Scope root = new Scope();
        List<StatementResult> statements = new ArrayList<>(program.statements().size());
        for (AlphaBracket statement : program.statements()) {
            Evaluation evaluation = CommandTables.ALPHA.dispatch(run, statement, root);
            statements.add(StatementResult.of(statement.command(), statement.line(), evaluation));
        }
        logger.fine(() -> "Interpreted " + program.statements().size() + " statements, registered "
            + run.registeredIds().size() + " patterns");
        return new InterpretationResult(run.registeredIds(), run.warnings(), statements);
    }
}
