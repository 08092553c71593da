/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.runtime.pipeline;

import com.glyphforge.analysis.containment.ContainmentClusterer;
import com.glyphforge.analysis.containment.ContainmentGraph;
import com.glyphforge.analysis.features.FeatureExtractor;
import com.glyphforge.api.WarningSink;
import com.glyphforge.api.model.BoundingBox;
import com.glyphforge.api.model.ComponentPair;
import com.glyphforge.api.model.ComponentView;
import com.glyphforge.api.model.DslWarning;
import com.glyphforge.api.model.PatternDefinition;
import com.glyphforge.api.model.PatternKind;
import com.glyphforge.api.model.PatternMatch;
import com.glyphforge.api.model.RelationshipMatch;
import com.glyphforge.classification.UiRoleClassifier;
import com.glyphforge.compiler.registry.PatternRegistry;
import com.glyphforge.grid.Grid;
import com.glyphforge.grid.fill.CellPredicate;
import com.glyphforge.grid.fill.FloodFillEngine;
import com.glyphforge.grid.fill.GridComponent;
import com.glyphforge.infra.config.RecognitionConfig;
import com.glyphforge.infra.metrics.MetricsRegistry;
import com.glyphforge.model.AbstractComponent;
import com.glyphforge.model.ComponentModel;
import com.glyphforge.model.SpatialRelationshipAnalyzer;
import com.glyphforge.runtime.matching.PatternMatcher;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Turns a character grid into a {@link ComponentModel}.
 *
 * <h2>Stages</h2>
 * <ol>
 *   <li>flood-fill: border regions over the boundary characters, then content regions
 *       over every other visible character (single spaces between content characters on
 *       the same row join words when {@code mergeWordGaps} is set)</li>
 *   <li>containment: strict bounding-box nesting, transitively reduced</li>
 *   <li>classify: decision-tree UI role per component</li>
 *   <li>match-patterns: the best matching track pattern overrides the role and adds its
 *       properties; required and prohibited patterns raise PATTERN warnings</li>
 *   <li>build-model: parent links, spatial relationships and relate patterns over
 *       parent/child and sibling pairs</li>
 * </ol>
 *
 * <p>A pipeline instance holds no per-run state, but the registry it matches against must
 * not be mutated while a run is in progress. Give concurrent runs their own registry copy.
 */
public class RecognitionPipeline {

    private static final Logger logger = Logger.getLogger(RecognitionPipeline.class.getName());

    public static final String PROPERTY_PATTERN = "pattern";
    public static final String PROPERTY_CONFIDENCE = "confidence";
    public static final String PROPERTY_TEXT = "text";
    public static final String PROPERTY_CLASSIFIED_ROLE = "classified_role";

    private final RecognitionConfig config;
    private final PatternRegistry registry;
    private final UiRoleClassifier classifier;
    private final PatternMatcher matcher;
    private final Tracer tracer;
    private final MetricsRegistry metrics;
    private final WarningSink sink;

    public RecognitionPipeline(RecognitionConfig config,
                               PatternRegistry registry,
                               UiRoleClassifier classifier,
                               Tracer tracer,
                               MetricsRegistry metrics,
                               WarningSink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.matcher = new PatternMatcher(registry);
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.metrics = metrics == null ? MetricsRegistry.noop() : metrics;
        this.sink = sink == null ? WarningSink.discarding() : sink;
    }

    /**
     * Pipeline with the default classifier, no metrics and a discarding warning sink.
     */
    public static RecognitionPipeline create(RecognitionConfig config, PatternRegistry registry, Tracer tracer) {
        UiRoleClassifier classifier = UiRoleClassifier.withDefaults(
            new FeatureExtractor(config.boundaryChars()), config.maxDepth());
        return new RecognitionPipeline(config, registry, classifier, tracer, MetricsRegistry.noop(), null);
    }

    public RecognitionConfig config() {
        return config;
    }

    /**
     * @throws IllegalArgumentException if the grid has more cells than the configured maximum
     */
    public RecognitionResult recognize(Grid grid) {
        if (grid.cellCount() > config.maxGridCells()) {
            throw new IllegalArgumentException(String.format(
                "Grid of %dx%d cells exceeds the maximum of %d cells",
                grid.width(), grid.height(), config.maxGridCells()));
        }

        long start = System.nanoTime();
        Span span = tracer.spanBuilder("recognize").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("grid.width", grid.width());
            span.setAttribute("grid.height", grid.height());

            Discovery discovery = stage("flood-fill", () -> discover(grid));
            List<GridComponent> components = discovery.components();
            List<BoundingBox> boxes = new ArrayList<>(components.size());
            List<ComponentView> views = new ArrayList<>(components.size());
            for (int i = 0; i < components.size(); i++) {
                boxes.add(components.get(i).bounds());
                views.add(components.get(i).toView(id(i)));
            }

            ContainmentGraph containment = stage("containment", () -> new ContainmentClusterer().cluster(boxes));
            List<String> roles = stage("classify", () -> classifier.classifyAll(components));

            List<DslWarning> warnings = new ArrayList<>();
            Map<String, List<PatternMatch>> matches = stage("match-patterns", () -> matchAll(views, warnings));

            ComponentModel model = stage("build-model",
                () -> buildModel(discovery, views, roles, matches, containment));

            warnings.forEach(sink::warn);
            metrics.counter(MetricsRegistry.GRIDS_PROCESSED).increment();
            metrics.counter(MetricsRegistry.COMPONENTS_DISCOVERED).increment(components.size());
            metrics.counter(MetricsRegistry.DSL_WARNINGS).increment(warnings.size());
            metrics.timer(MetricsRegistry.RECOGNITION_LATENCY).record(Duration.ofNanos(System.nanoTime() - start));

            span.setAttribute("componentCount", components.size());
            logger.info(String.format("Recognized %d components (%d roots, %d matched) in %dx%d grid",
                components.size(), containment.roots().size(), matches.size(), grid.width(), grid.height()));
            return new RecognitionResult(model, components, containment, matches, warnings);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Discovery discover(Grid grid) {
        FloodFillEngine engine = new FloodFillEngine(config.connectivity());
        CellPredicate border = (g, x, y) -> config.isBoundary(g.get(x, y));
        CellPredicate content = this::isContent;
        if (config.mergeWordGaps()) {
            content = content.or(this::isWordGap);
        }

        List<GridComponent> found = new ArrayList<>();
        for (GridComponent component : engine.findConnectedComponents(grid, border)) {
            if (component.cellCount() >= config.minComponentSize()) {
                found.add(component);
            }
        }
        int borderCount = found.size();
        for (GridComponent component : engine.findConnectedComponents(grid, content)) {
            if (component.cellCount() >= config.minComponentSize()) {
                found.add(component);
            }
        }
        logger.fine(() -> "Flood fill found " + borderCount + " border and "
            + (found.size() - borderCount) + " content components");
        return new Discovery(found, borderCount);
    }

    private boolean isContent(Grid grid, int x, int y) {
        char c = grid.get(x, y);
        return !config.isBoundary(c) && !config.isWhitespace(c);
    }

    private boolean isWordGap(Grid grid, int x, int y) {
        return grid.get(x, y) == ' '
            && x > 0 && x < grid.width() - 1
            && isContent(grid, x - 1, y)
            && isContent(grid, x + 1, y);
    }

    private Map<String, List<PatternMatch>> matchAll(List<ComponentView> views, List<DslWarning> warnings) {
        Map<String, List<PatternMatch>> matches = new LinkedHashMap<>();
        Set<String> matchedPatterns = new HashSet<>();
        int total = 0;
        for (ComponentView view : views) {
            List<PatternMatch> found = matcher.matchComponent(view);
            if (found.isEmpty()) {
                continue;
            }
            matches.put(view.id(), found);
            total += found.size();
            for (PatternMatch match : found) {
                matchedPatterns.add(match.patternId());
                if (registry.get(match.patternId()).prohibited()) {
                    warnings.add(new DslWarning(DslWarning.Kind.PATTERN, String.format(
                        "Prohibited pattern '%s' matched component %s", match.patternId(), view.id()), 0));
                }
            }
        }
        for (PatternDefinition definition : registry.componentPatterns()) {
            if (definition.required() && !matchedPatterns.contains(definition.id())) {
                warnings.add(new DslWarning(DslWarning.Kind.PATTERN, String.format(
                    "Required pattern '%s' matched no component", definition.id()), 0));
            }
        }
        metrics.counter(MetricsRegistry.PATTERN_MATCHES).increment(total);
        return matches;
    }

    private ComponentModel buildModel(Discovery discovery,
                                      List<ComponentView> views,
                                      List<String> roles,
                                      Map<String, List<PatternMatch>> matches,
                                      ContainmentGraph containment) {
        List<GridComponent> components = discovery.components();
        ComponentModel model = new ComponentModel();
        for (int i = 0; i < components.size(); i++) {
            ComponentView view = views.get(i);
            AbstractComponent component = model.add(
                new AbstractComponent(view.id(), roles.get(i), view.bounds(), view.contentLines()));
            component.setProperty(PROPERTY_CLASSIFIED_ROLE, roles.get(i));
            if (i >= discovery.borderCount()) {
                String text = ComponentText.derive(view.contentLines());
                if (!text.isEmpty()) {
                    component.setProperty(PROPERTY_TEXT, text);
                }
            }
            applyMatches(component, matches.getOrDefault(view.id(), List.of()));
        }

        for (int i = 0; i < components.size(); i++) {
            int parent = containment.parent(i);
            if (parent != ContainmentGraph.VIRTUAL_ROOT) {
                model.attach(id(parent), id(i));
            }
        }

        new SpatialRelationshipAnalyzer().analyze(model);
        relate(model);
        return model;
    }

    private static void applyMatches(AbstractComponent component, List<PatternMatch> matches) {
        if (matches.isEmpty()) {
            return;
        }
        // lowest-ranked extraction properties first, the top match overwrites
        for (int i = matches.size() - 1; i > 0; i--) {
            if (matches.get(i).kind() == PatternKind.GATHER) {
                component.setProperties(matches.get(i).result().properties());
            }
        }
        PatternMatch top = matches.get(0);
        component.setProperties(top.result().properties());
        component.setProperty(PROPERTY_PATTERN, top.patternId());
        component.setProperty(PROPERTY_CONFIDENCE, top.confidence());
        if (top.uiRole() != null) {
            component.setUiRole(top.uiRole());
        }
    }

    private void relate(ComponentModel model) {
        if (registry.relationshipPatterns().isEmpty()) {
            return;
        }
        List<ComponentPair> pairs = new ArrayList<>();
        for (AbstractComponent component : model.components()) {
            model.parent(component.getId())
                .ifPresent(parent -> pairs.add(new ComponentPair(parent.toView(), component.toView())));
        }
        for (List<AbstractComponent> siblings : model.siblingGroups()) {
            for (AbstractComponent a : siblings) {
                for (AbstractComponent b : siblings) {
                    if (a != b) {
                        pairs.add(new ComponentPair(a.toView(), b.toView()));
                    }
                }
            }
        }
        for (RelationshipMatch match : matcher.matchRelationships(pairs)) {
            model.relate(match.sourceId(), match.relationship(), match.targetId());
        }
    }

    private <T> T stage(String name, Supplier<T> body) {
        Span span = tracer.spanBuilder(name).startSpan();
        try (Scope scope = span.makeCurrent()) {
            return body.get();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static String id(int index) {
        return "c" + index;
    }

    /** Border components come first, at indices below {@code borderCount}. */
    private record Discovery(List<GridComponent> components, int borderCount) {
    }
}
