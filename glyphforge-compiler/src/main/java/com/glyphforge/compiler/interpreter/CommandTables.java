/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.interpreter;

import com.glyphforge.compiler.ast.AlphaBracket;
import com.glyphforge.compiler.ast.BetaBracket;
import com.glyphforge.compiler.ast.DeltaBracket;
import com.glyphforge.compiler.ast.GammaBracket;

import java.util.List;

/**
 * The fixed command set, built once per class load.
 */
final class CommandTables {

    static final CommandTable<AlphaBracket, Evaluation> ALPHA = new CommandTable<AlphaBracket, Evaluation>("alpha")
        .register("hunt", InterpretationRun::hunt)
        .register("Track", InterpretationRun::track)
        .register("RACK", InterpretationRun::rack);

    static final CommandTable<BetaBracket, Evaluation> BETA = new CommandTable<BetaBracket, Evaluation>("beta")
        .register("INIT", InterpretationRun::init)
        .register("GATHER", InterpretationRun::gather)
        .register("GET", InterpretationRun::gather)
        .register("HARVEST", InterpretationRun::gather)
        .register("HARV", InterpretationRun::gather)
        .register("trap", InterpretationRun::betaTrap)
        .register("scent", InterpretationRun::betaScent)
        .register("snare", InterpretationRun::betaSnare);

    static final CommandTable<GammaBracket, Evaluation> GAMMA = new CommandTable<GammaBracket, Evaluation>("gamma")
        .register("param", InterpretationRun::param)
        .register("tag", InterpretationRun::tag)
        .register("pluck", InterpretationRun::pluck)
        .register("trap", InterpretationRun::gammaTrap)
        .register("scent", InterpretationRun::gammaScent)
        .register("snare", InterpretationRun::gammaSnare);

    static final CommandTable<DeltaBracket, List<String>> DELTA = new CommandTable<DeltaBracket, List<String>>("delta")
        .register("val", InterpretationRun::val);

    private CommandTables() {
    }
}
