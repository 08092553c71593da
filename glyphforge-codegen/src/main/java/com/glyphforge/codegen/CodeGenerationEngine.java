/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.codegen;

import com.glyphforge.api.model.BoundingBox;
import com.glyphforge.codegen.template.ComponentTemplate;
import com.glyphforge.codegen.template.TemplateSet;
import com.glyphforge.codegen.template.TemplateSets;
import com.glyphforge.codegen.template.TextTemplate;
import com.glyphforge.model.AbstractComponent;
import com.glyphforge.model.ComponentModel;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Renders a {@link ComponentModel} as source code for one toolkit.
 *
 * <p>The containment forest is walked depth-first. Each component is rendered with the
 * template for its UI role (or the set's default template); a component without either is
 * skipped together with its subtree. Child blocks replace a {@code {children}} line of the
 * parent block when present and are appended after it otherwise, indented one step further.
 *
 * <h2>Placeholders</h2>
 * <ul>
 *   <li>{@code id}, {@code role}, {@code text}, {@code var}: component id, UI role, display
 *       text (escaped for a quoted literal) and generated variable name</li>
 *   <li>{@code x}, {@code y}, {@code width}, {@code height}: cell geometry relative to the
 *       parent component</li>
 *   <li>{@code px}, {@code py}, {@code pw}, {@code ph}: the same geometry in pixels, scaled by
 *       the {@code cell_width} / {@code cell_height} options</li>
 *   <li>{@code parent}: reference to the enclosing rendered component, or the set's root</li>
 * </ul>
 * Any generation option is also available as a placeholder.
 */
public class CodeGenerationEngine {
    private static final Logger logger = Logger.getLogger(CodeGenerationEngine.class.getName());

    public static final String OPTION_CELL_WIDTH = "cell_width";
    public static final String OPTION_CELL_HEIGHT = "cell_height";
    public static final int DEFAULT_CELL_WIDTH = 8;
    public static final int DEFAULT_CELL_HEIGHT = 16;

    private static final String TEXT_PROPERTY = "text";

    private final Tracer tracer;

    public CodeGenerationEngine(Tracer tracer) {
        this.tracer = tracer;
    }

    public String generate(ComponentModel model, String toolkit) {
        return generate(model, TemplateSets.get(toolkit), Map.of());
    }

    public String generate(ComponentModel model, TemplateSet templates, Map<String, String> options) {
        Span span = tracer.spanBuilder("generate-code").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("toolkit", templates.name());
            span.setAttribute("componentCount", model.size());

            Map<String, String> base = new HashMap<>(templates.defaultOptions());
            base.putAll(options);
            GenerationRun run = new GenerationRun(model, templates, base);

            List<String> lines = new ArrayList<>(templates.prologue().render("", base));
            for (AbstractComponent root : model.roots()) {
                lines.addAll(run.render(root, null, templates.rootIndent()));
            }
            lines.addAll(templates.epilogue().render("", base));

            logger.fine(() -> String.format("Generated %d lines of %s code for %d components (%d skipped)",
                lines.size(), templates.name(), model.size(), run.skipped));
            return String.join("\n", lines) + "\n";
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Variable name for a component: role and id, reduced to identifier characters. */
    static String variableName(AbstractComponent component) {
        String role = component.getUiRole() == null ? "component" : component.getUiRole();
        return (role + "_" + component.getId()).replaceAll("[^A-Za-z0-9_]", "_");
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("'", "\\'").replace("\"", "\\\"");
    }

    private static final class GenerationRun {
        private final ComponentModel model;
        private final TemplateSet templates;
        private final Map<String, String> options;
        private final int cellWidth;
        private final int cellHeight;
        private int skipped;

        GenerationRun(ComponentModel model, TemplateSet templates, Map<String, String> options) {
            this.model = model;
            this.templates = templates;
            this.options = options;
            this.cellWidth = intOption(options, OPTION_CELL_WIDTH, DEFAULT_CELL_WIDTH);
            this.cellHeight = intOption(options, OPTION_CELL_HEIGHT, DEFAULT_CELL_HEIGHT);
        }

        List<String> render(AbstractComponent component, AbstractComponent parent, String indent) {
            Optional<ComponentTemplate> template = templates.templateFor(component.getUiRole());
            if (template.isEmpty()) {
                skipped++;
                logger.fine(() -> "No template for role '" + component.getUiRole()
                    + "', skipping " + component.getId());
                return List.of();
            }

            List<String> block = template.get().render(component, indent, variables(component, parent));

            List<String> children = new ArrayList<>();
            for (AbstractComponent child : model.children(component.getId())) {
                children.addAll(render(child, component, indent + templates.indentStep()));
            }

            List<String> out = new ArrayList<>(block.size() + children.size());
            boolean substituted = false;
            for (String line : block) {
                if (line.strip().equals(TextTemplate.CHILDREN)) {
                    out.addAll(children);
                    substituted = true;
                } else {
                    out.add(line);
                }
            }
            if (!substituted) {
                out.addAll(children);
            }
            return out;
        }

        private Map<String, String> variables(AbstractComponent component, AbstractComponent parent) {
            BoundingBox bounds = component.getBounds();
            int x = bounds.xMin();
            int y = bounds.yMin();
            if (parent != null) {
                x -= parent.getBounds().xMin();
                y -= parent.getBounds().yMin();
            }

            Map<String, String> vars = new HashMap<>(options);
            vars.put("id", component.getId());
            vars.put("role", String.valueOf(component.getUiRole()));
            vars.put("var", variableName(component));
            vars.put("text", escape(component.getStringProperty(TEXT_PROPERTY, "")));
            vars.put("x", Integer.toString(x));
            vars.put("y", Integer.toString(y));
            vars.put("width", Integer.toString(bounds.width()));
            vars.put("height", Integer.toString(bounds.height()));
            vars.put("px", Integer.toString(x * cellWidth));
            vars.put("py", Integer.toString(y * cellHeight));
            vars.put("pw", Integer.toString(bounds.width() * cellWidth));
            vars.put("ph", Integer.toString(bounds.height() * cellHeight));
            vars.put("parent", parent == null
                ? templates.rootReference()
                : templates.reference(variableName(parent)));
            return vars;
        }

        private static int intOption(Map<String, String> options, String key, int defaultValue) {
            String value = options.get(key);
            if (value == null) {
                return defaultValue;
            }
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
            } catch (NumberFormatException e) {
                logger.warning("Invalid " + key + " option '" + value + "': " + e.getMessage());
                return defaultValue;
            }
            logger.warning("Ignoring non-positive " + key + " option '" + value + "'");
            return defaultValue;
        }
    }
}
