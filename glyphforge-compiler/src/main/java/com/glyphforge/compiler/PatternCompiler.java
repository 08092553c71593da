/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler;

import com.glyphforge.api.CompilationListener;
import com.glyphforge.api.IPatternCompiler;
import com.glyphforge.api.WarningSink;
import com.glyphforge.api.exceptions.DslFatalException;
import com.glyphforge.api.exceptions.ParseException;
import com.glyphforge.api.exceptions.RegistrationException;
import com.glyphforge.api.model.CompilationResult;
import com.glyphforge.compiler.ast.Program;
import com.glyphforge.compiler.interpreter.HuntInterpreter;
import com.glyphforge.compiler.interpreter.InterpretationResult;
import com.glyphforge.compiler.lexer.Token;
import com.glyphforge.compiler.lexer.Tokenizer;
import com.glyphforge.compiler.parser.HuntParser;
import com.glyphforge.compiler.registry.PatternRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles pattern DSL source into a {@link PatternRegistry}.
 *
 * <h2>Stages</h2>
 * <ol>
 *   <li>TOKENIZE: source text to tokens, never fails</li>
 *   <li>PARSE: tokens to a bracket tree, fails with {@link ParseException}</li>
 *   <li>INTERPRET: commands evaluated, patterns registered</li>
 * </ol>
 * Each stage runs in its own span and is reported to the {@link CompilationListener}.
 *
 * <p>Not thread-safe; use one compiler per registry.
 */
public class PatternCompiler implements IPatternCompiler {

    private static final Logger logger = Logger.getLogger(PatternCompiler.class.getName());

    private static final int TOTAL_STAGES = 3;

    private final PatternRegistry registry;
    private final WarningSink sink;
    private final boolean fatalTraps;
    private Tracer tracer;
    private CompilationListener listener;

    public PatternCompiler(PatternRegistry registry, WarningSink sink, boolean fatalTraps) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sink = sink == null ? WarningSink.discarding() : sink;
        this.fatalTraps = fatalTraps;
        this.tracer = OpenTelemetry.noop().getTracer("glyphforge-compiler");
    }

    public PatternCompiler(PatternRegistry registry) {
        this(registry, WarningSink.discarding(), false);
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    public PatternRegistry registry() {
        return registry;
    }

    @Override
    public CompilationResult compile(String source, String sourceName) {
        long start = System.nanoTime();
        Span span = tracer.spanBuilder("compile-patterns").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("sourceName", sourceName);

            List<Token> tokens = stage("TOKENIZE", 1, () -> new Tokenizer().tokenize(source),
                t -> Map.of("tokenCount", t.size()));
            Program program = stage("PARSE", 2, () -> new HuntParser().parse(tokens),
                p -> Map.of("statementCount", p.statements().size()));
            InterpretationResult result = stage("INTERPRET", 3,
                () -> new HuntInterpreter(registry, sink, fatalTraps).interpret(program),
                r -> Map.of("patternCount", r.patternIds().size(), "warningCount", r.warnings().size()));

            span.setAttribute("patternCount", result.patternIds().size());
            logger.info(String.format("Compiled '%s': registered %s, %d warnings",
                sourceName, result.patternIds(), result.warnings().size()));
            return new CompilationResult(sourceName, result.patternIds(), result.warnings(), null,
                System.nanoTime() - start);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public CompilationResult compile(Path sourcePath) throws IOException {
        String source = Files.readString(sourcePath, StandardCharsets.UTF_8);
        return compile(source, sourcePath.getFileName().toString());
    }

    /**
     * Compiles several sources in iteration order. A parse, registration or fatal
     * interpretation error rejects only the source that raised it; patterns from the other
     * sources, and those registered by the failing source before the error, stay registered.
     *
     * @param sources source name to DSL text
     */
    public List<CompilationResult> compileAll(Map<String, String> sources) {
        List<CompilationResult> results = new ArrayList<>(sources.size());
        for (Map.Entry<String, String> entry : sources.entrySet()) {
            long start = System.nanoTime();
            try {
                results.add(compile(entry.getValue(), entry.getKey()));
            } catch (ParseException | RegistrationException | DslFatalException e) {
                logger.log(Level.WARNING, "Rejected pattern source '" + entry.getKey() + "': " + e.getMessage());
                results.add(new CompilationResult(entry.getKey(), List.of(), List.of(), e.getMessage(),
                    System.nanoTime() - start));
            }
        }
        return results;
    }

    private <T> T stage(String name, int number, Supplier<T> body,
                        Function<T, Map<String, Object>> metrics) {
        if (listener != null) {
            listener.onStageStart(name, number, TOTAL_STAGES);
        }
        Span span = tracer.spanBuilder(name.toLowerCase(Locale.ROOT)).startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            T value = body.get();
            if (listener != null) {
                listener.onStageComplete(name,
                    new CompilationListener.StageResult(name, System.nanoTime() - start, metrics.apply(value)));
            }
            return value;
        } catch (RuntimeException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(name, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }
}
