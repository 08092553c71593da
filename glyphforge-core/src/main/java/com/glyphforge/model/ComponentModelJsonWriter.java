package com.glyphforge.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.glyphforge.api.model.DslWarning;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes a {@link ComponentModel} to JSON.
 *
 * <pre>
 * {
 *   "roots": ["c0"],
 *   "components": [ { "id": "c0", "ui_role": "container", ... } ],
 *   "warnings": [ ... ]
 * }
 * </pre>
 */
public class ComponentModelJsonWriter {

    private final ObjectMapper mapper;

    public ComponentModelJsonWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ComponentModelJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Map<String, Object> toTree(ComponentModel model, List<DslWarning> warnings) {
        List<String> roots = new ArrayList<>();
        for (AbstractComponent root : model.roots()) {
            roots.add(root.getId());
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("roots", roots);
        document.put("components", model.depthFirst());
        document.put("warnings", warnings);
        return document;
    }

    public String write(ComponentModel model, List<DslWarning> warnings) {
        try {
            return mapper.writeValueAsString(toTree(model, warnings));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize component model", e);
        }
    }
}
