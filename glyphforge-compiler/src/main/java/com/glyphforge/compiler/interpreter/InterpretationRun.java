/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.interpreter;

import com.glyphforge.api.WarningSink;
import com.glyphforge.api.exceptions.DslFatalException;
import com.glyphforge.api.model.DslWarning;
import com.glyphforge.api.model.PatternDefinition;
import com.glyphforge.api.model.PatternKind;
import com.glyphforge.api.model.Rule;
import com.glyphforge.api.model.RuleCommand;
import com.glyphforge.compiler.ast.AlphaBracket;
import com.glyphforge.compiler.ast.BetaBracket;
import com.glyphforge.compiler.ast.DeltaBracket;
import com.glyphforge.compiler.ast.ExecClause;
import com.glyphforge.compiler.ast.ExecParam;
import com.glyphforge.compiler.ast.GammaBracket;
import com.glyphforge.compiler.ast.Literal;
import com.glyphforge.compiler.registry.PatternRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * State of a single interpretation: the target registry, warnings raised so far and the
 * ids registered. Holds the command handlers referenced from {@link CommandTables}.
 */
final class InterpretationRun {

    private static final Logger logger = Logger.getLogger(InterpretationRun.class.getName());

    static final String REQUIRED_FLAG = "req";
    static final String PROHIBITED_FLAG = "prohib";
    static final String INIT_BINDING = "current_init";

    private final PatternRegistry registry;
    private final WarningSink sink;
    private final boolean fatalTraps;
    private final List<DslWarning> warnings = new ArrayList<>();
    private final List<String> registeredIds = new ArrayList<>();

    InterpretationRun(PatternRegistry registry, WarningSink sink, boolean fatalTraps) {
        this.registry = registry;
        this.sink = sink;
        this.fatalTraps = fatalTraps;
    }

    List<DslWarning> warnings() {
        return warnings;
    }

    List<String> registeredIds() {
        return registeredIds;
    }

    // ---- alpha ----

    Evaluation hunt(AlphaBracket node, Scope scope) {
        if (node.hasModifier("Track")) {
            return track(node, scope);
        }
        if (node.hasModifier("RACK")) {
            return rack(node, scope);
        }
        Scope local = scope.child();
        Evaluation evaluation = exec(node.exec(), local);
        for (BetaBracket beta : node.children()) {
            evaluation.merge(CommandTables.BETA.dispatch(this, beta, local));
        }
        return evaluation;
    }

    Evaluation track(AlphaBracket node, Scope scope) {
        return registerStatement(node, scope, PatternKind.TRACK, "track");
    }

    Evaluation rack(AlphaBracket node, Scope scope) {
        return registerStatement(node, scope, PatternKind.RELATE, "relate");
    }

    private Evaluation registerStatement(AlphaBracket node, Scope scope, PatternKind kind, String prefix) {
        Scope local = scope.child();
        Evaluation evaluation = exec(node.exec(), local);
        for (BetaBracket beta : node.children()) {
            evaluation.merge(CommandTables.BETA.dispatch(this, beta, local));
        }
        String id = node.bridgeTarget() != null
            ? node.bridgeTarget()
            : defaultId(prefix, evaluation.rules(), true);
        register(id, kind, evaluation, local);
        return evaluation;
    }

    private Evaluation exec(ExecClause exec, Scope scope) {
        Evaluation evaluation = Evaluation.empty();
        if (exec == null) {
            return evaluation;
        }
        for (ExecParam param : exec.params()) {
            if (param.nested() != null) {
                evaluation.merge(CommandTables.GAMMA.dispatch(this, param.nested(), scope));
            }
            if (param.nested() != null && param.name().equals(param.nested().command())) {
                continue;
            }
            if (REQUIRED_FLAG.equals(param.name()) || PROHIBITED_FLAG.equals(param.name())) {
                scope.define(param.name(), param.value() == null ? "true" : resolve(param.value(), scope));
            } else if (param.value() != null) {
                evaluation.addParam(param.name(), List.of(resolve(param.value(), scope)));
            } else {
                evaluation.addParam(param.name(), List.of("true"));
            }
        }
        return evaluation;
    }

    // ---- beta ----

    /**
     * Runs the gammas in a child scope where {@value #INIT_BINDING} holds the resolved INIT
     * value. An identifier value is also bound under its own name.
     */
    Evaluation init(BetaBracket node, Scope scope) {
        Scope local = scope.child();
        if (node.value() != null) {
            String value = resolve(node.value(), scope);
            local.define(INIT_BINDING, value);
            if (node.value().kind() == Literal.Kind.IDENTIFIER) {
                local.define(node.value().text(), value);
            }
        }
        return gammas(node.children(), local);
    }

    Evaluation gather(BetaBracket node, Scope scope) {
        Scope local = scope.child();
        Evaluation evaluation = gammas(node.children(), local);
        String id = node.value() != null
            ? resolve(node.value(), scope)
            : defaultId("gather", evaluation.rules(), false);
        register(id, PatternKind.GATHER, evaluation, local);
        return Evaluation.empty();
    }

    Evaluation betaTrap(BetaBracket node, Scope scope) {
        if (node.value() == null) {
            throw new DslFatalException("trap requires a target", node.line());
        }
        checkTrap(resolve(node.value(), scope), node.line());
        return Evaluation.empty();
    }

    Evaluation betaScent(BetaBracket node, Scope scope) {
        String message = node.value() != null ? resolve(node.value(), scope) : "scent";
        warn(DslWarning.Kind.SCENT, message, node.line());
        return Evaluation.empty();
    }

    Evaluation betaSnare(BetaBracket node, Scope scope) {
        String message = node.value() != null ? resolve(node.value(), scope) : "snare";
        throw new DslFatalException(message, node.line());
    }

    private Evaluation gammas(List<GammaBracket> gammas, Scope scope) {
        Evaluation evaluation = Evaluation.empty();
        for (GammaBracket gamma : gammas) {
            evaluation.merge(CommandTables.GAMMA.dispatch(this, gamma, scope));
        }
        return evaluation;
    }

    // ---- gamma ----

    Evaluation param(GammaBracket node, Scope scope) {
        if (node.hasModifier("tag")) {
            return rule(RuleCommand.TAG, node, scope);
        }
        if (node.hasModifier("pluck")) {
            return rule(RuleCommand.PLUCK, node, scope);
        }
        String name = node.bridgeTarget() != null
            ? node.bridgeTarget()
            : node.modifiers().isEmpty() ? null : node.modifiers().get(0);
        if (name == null) {
            throw new DslFatalException("param requires a name", node.line());
        }
        List<String> values = new ArrayList<>();
        if (node.value() != null) {
            values.add(resolve(node.value(), scope));
        }
        values.addAll(deltaValues(node, scope));
        scope.define(name, String.join(",", values));
        return Evaluation.empty().addParam(name, values);
    }

    Evaluation tag(GammaBracket node, Scope scope) {
        return rule(RuleCommand.TAG, node, scope);
    }

    Evaluation pluck(GammaBracket node, Scope scope) {
        return rule(RuleCommand.PLUCK, node, scope);
    }

    private Evaluation rule(RuleCommand command, GammaBracket node, Scope scope) {
        String target;
        List<String> values = new ArrayList<>();
        if (node.bridgeTarget() != null) {
            target = node.bridgeTarget();
            if (node.value() != null) {
                values.add(resolve(node.value(), scope));
            }
        } else if (node.value() != null) {
            target = resolve(node.value(), scope);
        } else {
            throw new DslFatalException(command.keyword() + " requires a target", node.line());
        }
        values.addAll(deltaValues(node, scope));
        return Evaluation.ofRule(new Rule(command, target, values));
    }

    Evaluation gammaTrap(GammaBracket node, Scope scope) {
        String target = node.bridgeTarget();
        if (target == null && node.value() != null) {
            target = resolve(node.value(), scope);
        }
        if (target == null) {
            List<String> values = deltaValues(node, scope);
            if (values.isEmpty()) {
                throw new DslFatalException("trap requires a target", node.line());
            }
            target = values.get(0);
        }
        checkTrap(target, node.line());
        return Evaluation.empty();
    }

    Evaluation gammaScent(GammaBracket node, Scope scope) {
        List<String> values = deltaValues(node, scope);
        String message;
        if (!values.isEmpty()) {
            message = String.join(", ", values);
        } else if (node.value() != null) {
            message = resolve(node.value(), scope);
        } else {
            message = node.bridgeTarget() != null ? node.bridgeTarget() : "scent";
        }
        warn(DslWarning.Kind.SCENT, message, node.line());
        return Evaluation.empty();
    }

    Evaluation gammaSnare(GammaBracket node, Scope scope) {
        List<String> values = deltaValues(node, scope);
        String message = values.isEmpty()
            ? (node.value() != null ? resolve(node.value(), scope) : "snare")
            : String.join(" ", values);
        throw new DslFatalException(message, node.line());
    }

    private List<String> deltaValues(GammaBracket node, Scope scope) {
        List<String> values = new ArrayList<>();
        for (DeltaBracket delta : node.children()) {
            values.addAll(CommandTables.DELTA.dispatch(this, delta, scope));
        }
        return values;
    }

    // ---- delta ----

    List<String> val(DeltaBracket node, Scope scope) {
        List<String> values = new ArrayList<>(node.values().size());
        for (Literal literal : node.values()) {
            values.add(resolve(literal, scope));
        }
        return values;
    }

    // ---- helpers ----

    private static String resolve(Literal literal, Scope scope) {
        if (literal.kind() == Literal.Kind.IDENTIFIER) {
            return scope.lookup(literal.text()).orElse(literal.text());
        }
        return literal.text();
    }

    private static String defaultId(String prefix, List<Rule> rules, boolean fromTags) {
        for (Rule rule : rules) {
            if (!fromTags || rule.command() == RuleCommand.TAG) {
                return prefix + "_" + rule.target();
            }
        }
        return "default_" + prefix;
    }

    private void register(String id, PatternKind kind, Evaluation evaluation, Scope scope) {
        Map<String, String> options = new LinkedHashMap<>();
        evaluation.params().forEach((name, values) -> options.put(name, String.join(",", values)));
        PatternDefinition definition = new PatternDefinition(
            id, kind, evaluation.rules(), options,
            scope.isSet(REQUIRED_FLAG), scope.isSet(PROHIBITED_FLAG));
        registry.register(definition);
        registeredIds.add(id);
        logger.fine(() -> "Registered " + kind + " pattern '" + id + "' with "
            + definition.rules().size() + " rules");
    }

    private void checkTrap(String target, int line) {
        if (registry.contains(target) || registry.hasTag(target)) {
            return;
        }
        String message = "Trap target '" + target + "' is not a registered pattern or tag";
        if (fatalTraps) {
            throw new DslFatalException(message, line);
        }
        warn(DslWarning.Kind.TRAP, message, line);
    }

    private void warn(DslWarning.Kind kind, String message, int line) {
        DslWarning warning = new DslWarning(kind, message, line);
        warnings.add(warning);
        sink.warn(warning);
    }
}
