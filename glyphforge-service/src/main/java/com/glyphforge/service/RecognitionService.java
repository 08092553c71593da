/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.service;

import com.glyphforge.analysis.features.FeatureExtractor;
import com.glyphforge.api.CollectingWarningSink;
import com.glyphforge.api.model.CompilationResult;
import com.glyphforge.classification.UiRoleClassifier;
import com.glyphforge.codegen.CodeGenerationEngine;
import com.glyphforge.codegen.template.TemplateSets;
import com.glyphforge.compiler.PatternCompiler;
import com.glyphforge.compiler.analysis.PatternOverlapAnalyzer;
import com.glyphforge.compiler.library.BuiltInPatterns;
import com.glyphforge.compiler.registry.PatternRegistry;
import com.glyphforge.grid.Grid;
import com.glyphforge.infra.config.RecognitionConfig;
import com.glyphforge.infra.metrics.MetricsRegistry;
import com.glyphforge.model.ComponentModelJsonWriter;
import com.glyphforge.runtime.pipeline.RecognitionPipeline;
import com.glyphforge.runtime.pipeline.RecognitionResult;
import com.glyphforge.service.model.RecognizeRequest;
import com.glyphforge.service.model.RecognizeResponse;
import com.glyphforge.service.model.ValidationResponse;
import io.opentelemetry.api.trace.Tracer;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs grid recognition and code generation for the host application.
 *
 * <p>The built-in pattern library is compiled once; every request works on its own copy
 * of that registry so submitted patterns never leak between requests. The trained
 * classifier is shared. Thread-safe.
 */
public class RecognitionService {
    private static final Logger logger = Logger.getLogger(RecognitionService.class.getName());

    public static final String NO_CODE = "none";
    private static final String REQUEST_SOURCE = "request";

    private final RecognitionConfig config;
    private final Tracer tracer;
    private final MetricsRegistry metrics;
    private final PatternRegistry builtIns;
    private final UiRoleClassifier classifier;
    private final CodeGenerationEngine codeGenerator;
    private final ComponentModelJsonWriter modelWriter = new ComponentModelJsonWriter();

    public RecognitionService(RecognitionConfig config, Tracer tracer, MetricsRegistry metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.builtIns = BuiltInPatterns.newRegistry();
        this.classifier = UiRoleClassifier.withDefaults(
            new FeatureExtractor(config.boundaryChars()), config.maxDepth());
        this.codeGenerator = new CodeGenerationEngine(tracer);
        logger.info("Recognition service ready with " + builtIns.size() + " built-in patterns, " + config);
    }

    public RecognitionConfig config() {
        return config;
    }

    public int builtInPatternCount() {
        return builtIns.size();
    }

    /**
     * @throws IllegalArgumentException for a missing or oversized grid or an unknown toolkit
     * @throws com.glyphforge.api.exceptions.ParseException if the submitted patterns do not parse
     * @throws com.glyphforge.api.exceptions.DslFatalException if the submitted patterns halt
     */
    public RecognizeResponse recognize(RecognizeRequest request) {
        if (request == null || request.grid() == null) {
            throw new IllegalArgumentException("grid is required");
        }
        String toolkit = request.toolkit() == null || request.toolkit().isBlank()
            ? config.defaultToolkit()
            : request.toolkit();
        if (!NO_CODE.equals(toolkit)) {
            // fail before doing any work
            TemplateSets.get(toolkit);
        }

        Grid grid = Grid.fromText(request.grid(), config.maxGridCells());

        CollectingWarningSink sink = new CollectingWarningSink();
        PatternRegistry registry = builtIns.copy();
        if (request.patterns() != null && !request.patterns().isBlank()) {
            newCompiler(registry, sink).compile(request.patterns(), REQUEST_SOURCE);
        }

        RecognitionPipeline pipeline = new RecognitionPipeline(config, registry, classifier, tracer, metrics, sink);
        RecognitionResult result = pipeline.recognize(grid);

        String code = NO_CODE.equals(toolkit)
            ? null
            : codeGenerator.generate(result.model(), TemplateSets.get(toolkit), request.options());
        return new RecognizeResponse(
            modelWriter.toTree(result.model(), result.warnings()), sink.getWarnings(), toolkit, code);
    }

    /**
     * Compiles {@code source} against a copy of the built-in library. Compilation failures
     * are reported in the response, not thrown.
     */
    public ValidationResponse validate(String source) {
        PatternRegistry registry = builtIns.copy();
        CompilationResult compilation = newCompiler(registry, new CollectingWarningSink())
            .compileAll(Map.of(REQUEST_SOURCE, source == null ? "" : source))
            .get(0);
        List<PatternOverlapAnalyzer.PatternOverlap> overlaps = compilation.succeeded()
            ? new PatternOverlapAnalyzer().analyze(registry).sortedBySimilarity()
            : List.of();
        return new ValidationResponse(compilation.succeeded(), compilation, overlaps);
    }

    private PatternCompiler newCompiler(PatternRegistry registry, CollectingWarningSink sink) {
        PatternCompiler compiler = new PatternCompiler(registry, sink, config.fatalTraps());
        compiler.setTracer(tracer);
        return compiler;
    }
}
