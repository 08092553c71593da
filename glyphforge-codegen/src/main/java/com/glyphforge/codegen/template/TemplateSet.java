/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.codegen.template;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Templates for one target toolkit.
 *
 * <p>A component is rendered with the template registered for its UI role, else with the
 * default template. The prologue and epilogue wrap the generated blocks and may use the
 * generation options as placeholders.
 *
 * <h2>Usage</h2>
 * <pre>
 * TemplateSet set = TemplateSet.builder("html")
 *     .prologue("&lt;body&gt;")
 *     .template("button", new TextTemplate("&lt;button&gt;{text}&lt;/button&gt;"))
 *     .epilogue("&lt;/body&gt;")
 *     .build();
 * </pre>
 */
public final class TemplateSet {

    private final String name;
    private final TextTemplate prologue;
    private final TextTemplate epilogue;
    private final Map<String, ComponentTemplate> templates;
    private final ComponentTemplate defaultTemplate;
    private final String rootIndent;
    private final String indentStep;
    private final String rootReference;
    private final String referenceFormat;
    private final Map<String, String> defaultOptions;

    private TemplateSet(Builder builder) {
        this.name = builder.name;
        this.prologue = new TextTemplate(builder.prologue);
        this.epilogue = new TextTemplate(builder.epilogue);
        this.templates = Map.copyOf(builder.templates);
        this.defaultTemplate = builder.defaultTemplate;
        this.rootIndent = builder.rootIndent;
        this.indentStep = builder.indentStep;
        this.rootReference = builder.rootReference;
        this.referenceFormat = builder.referenceFormat;
        this.defaultOptions = Map.copyOf(builder.defaultOptions);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public TextTemplate prologue() {
        return prologue;
    }

    public TextTemplate epilogue() {
        return epilogue;
    }

    /**
     * Template for {@code role}, falling back to the default template; empty when neither
     * exists.
     */
    public Optional<ComponentTemplate> templateFor(String role) {
        ComponentTemplate template = role == null ? null : templates.get(role);
        return Optional.ofNullable(template != null ? template : defaultTemplate);
    }

    public boolean hasTemplate(String role) {
        return templates.containsKey(role);
    }

    public String rootIndent() {
        return rootIndent;
    }

    public String indentStep() {
        return indentStep;
    }

    /** Expression children of top-level components are attached to. */
    public String rootReference() {
        return rootReference;
    }

    /** Expression referring to a rendered component, with {@code {var}} as placeholder. */
    public String reference(String var) {
        return TextTemplate.substitute(referenceFormat, Map.of("var", var));
    }

    public Map<String, String> defaultOptions() {
        return defaultOptions;
    }

    public static final class Builder {
        private final String name;
        private List<String> prologue = List.of();
        private List<String> epilogue = List.of();
        private final Map<String, ComponentTemplate> templates = new LinkedHashMap<>();
        private ComponentTemplate defaultTemplate;
        private String rootIndent = "";
        private String indentStep = "    ";
        private String rootReference = "root";
        private String referenceFormat = "{var}";
        private final Map<String, String> defaultOptions = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder prologue(String... lines) {
            this.prologue = List.of(lines);
            return this;
        }

        public Builder epilogue(String... lines) {
            this.epilogue = List.of(lines);
            return this;
        }

        public Builder template(String role, ComponentTemplate template) {
            templates.put(role, template);
            return this;
        }

        public Builder defaultTemplate(ComponentTemplate template) {
            this.defaultTemplate = template;
            return this;
        }

        public Builder rootIndent(String rootIndent) {
            this.rootIndent = rootIndent;
            return this;
        }

        public Builder indentStep(String indentStep) {
            this.indentStep = indentStep;
            return this;
        }

        public Builder rootReference(String rootReference) {
            this.rootReference = rootReference;
            return this;
        }

        public Builder referenceFormat(String referenceFormat) {
            this.referenceFormat = referenceFormat;
            return this;
        }

        public Builder defaultOption(String key, String value) {
            defaultOptions.put(key, value);
            return this;
        }

        public TemplateSet build() {
            return new TemplateSet(this);
        }
    }
}
