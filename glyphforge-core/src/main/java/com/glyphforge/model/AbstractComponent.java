/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.glyphforge.api.model.BoundingBox;
import com.glyphforge.api.model.ComponentView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A recognized UI element inside a {@link ComponentModel}.
 *
 * <p>Parent and children are held as component ids; the model owns the components
 * themselves. Structural links are changed only through the model.
 */
@JsonPropertyOrder({"id", "ui_role", "bounds", "parent", "children", "properties", "relationships", "content"})
public class AbstractComponent {

    private final String id;
    private final BoundingBox bounds;
    private final List<String> contentLines;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<String> childIds = new ArrayList<>();
    private final List<ComponentRelationship> relationships = new ArrayList<>();
    private String uiRole;
    private String parentId;

    public AbstractComponent(String id, String uiRole, BoundingBox bounds, List<String> contentLines) {
        this.id = Objects.requireNonNull(id, "id");
        this.uiRole = uiRole;
        this.bounds = Objects.requireNonNull(bounds, "bounds");
        this.contentLines = List.copyOf(contentLines);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("ui_role")
    public String getUiRole() {
        return uiRole;
    }

    public void setUiRole(String uiRole) {
        this.uiRole = uiRole;
    }

    @JsonProperty("bounds")
    public BoundingBox getBounds() {
        return bounds;
    }

    @JsonProperty("content")
    public List<String> getContentLines() {
        return contentLines;
    }

    @JsonProperty("properties")
    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Object getProperty(String name) {
        return properties.get(name);
    }

    public String getStringProperty(String name, String defaultValue) {
        Object value = properties.get(name);
        return value == null ? defaultValue : value.toString();
    }

    public void setProperty(String name, Object value) {
        properties.put(name, value);
    }

    public void setProperties(Map<String, ?> values) {
        properties.putAll(values);
    }

    @JsonProperty("parent")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getParentId() {
        return parentId;
    }

    @JsonProperty("children")
    public List<String> getChildIds() {
        return Collections.unmodifiableList(childIds);
    }

    @JsonProperty("relationships")
    public List<ComponentRelationship> getRelationships() {
        return Collections.unmodifiableList(relationships);
    }

    public boolean hasRelationship(String kind, String targetId) {
        return relationships.contains(new ComponentRelationship(kind, targetId));
    }

    public ComponentView toView() {
        return new ComponentView(id, bounds, contentLines);
    }

    void setParentId(String parentId) {
        this.parentId = parentId;
    }

    void addChildId(String childId) {
        childIds.add(childId);
    }

    boolean addRelationship(ComponentRelationship relationship) {
        if (relationships.contains(relationship)) {
            return false;
        }
        return relationships.add(relationship);
    }

    @Override
    public String toString() {
        return "AbstractComponent{id='" + id + "', uiRole='" + uiRole + "', bounds=" + bounds + "}";
    }
}
