/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hierarchical model of recognized components, indexed by id.
 *
 * <p>Components keep insertion order. Each component has at most one parent and
 * attaching is refused if it would create a cycle, so the model is always a forest.
 * Not thread-safe; a model is built by one pipeline run and read afterwards.
 */
public class ComponentModel {

    private final Map<String, AbstractComponent> components = new LinkedHashMap<>();

    public AbstractComponent add(AbstractComponent component) {
        if (components.containsKey(component.getId())) {
            throw new IllegalArgumentException("Component '" + component.getId() + "' already exists");
        }
        components.put(component.getId(), component);
        return component;
    }

    /**
     * @throws IllegalArgumentException if no component has this id
     */
    public AbstractComponent get(String id) {
        AbstractComponent component = components.get(id);
        if (component == null) {
            throw new IllegalArgumentException("Component '" + id + "' not found");
        }
        return component;
    }

    public Optional<AbstractComponent> find(String id) {
        return Optional.ofNullable(components.get(id));
    }

    /**
     * Makes {@code childId} a child of {@code parentId}.
     *
     * @throws IllegalStateException if the child already has a parent or the link would form a cycle
     */
    public void attach(String parentId, String childId) {
        AbstractComponent parent = get(parentId);
        AbstractComponent child = get(childId);
        if (child.getParentId() != null) {
            throw new IllegalStateException(String.format(
                "Component '%s' already has parent '%s'", childId, child.getParentId()));
        }
        for (String p = parentId; p != null; p = components.get(p).getParentId()) {
            if (p.equals(childId)) {
                throw new IllegalStateException(String.format(
                    "Attaching '%s' under '%s' would create a cycle", childId, parentId));
            }
        }
        child.setParentId(parentId);
        parent.addChildId(childId);
    }

    /**
     * Records a named relationship; duplicates are ignored.
     *
     * @return true if the relationship was new
     */
    public boolean relate(String sourceId, String kind, String targetId) {
        get(targetId);
        return get(sourceId).addRelationship(new ComponentRelationship(kind, targetId));
    }

    public List<AbstractComponent> roots() {
        List<AbstractComponent> roots = new ArrayList<>();
        for (AbstractComponent component : components.values()) {
            if (component.getParentId() == null) {
                roots.add(component);
            }
        }
        return roots;
    }

    public List<AbstractComponent> children(String id) {
        List<AbstractComponent> children = new ArrayList<>();
        for (String childId : get(id).getChildIds()) {
            children.add(components.get(childId));
        }
        return children;
    }

    public Optional<AbstractComponent> parent(String id) {
        String parentId = get(id).getParentId();
        return parentId == null ? Optional.empty() : Optional.of(components.get(parentId));
    }

    /**
     * Groups of components sharing a parent: the roots first, then each component's
     * children in model order. Groups with fewer than two members are included.
     */
    public List<List<AbstractComponent>> siblingGroups() {
        List<List<AbstractComponent>> groups = new ArrayList<>();
        groups.add(roots());
        for (AbstractComponent component : components.values()) {
            if (!component.getChildIds().isEmpty()) {
                groups.add(children(component.getId()));
            }
        }
        return groups;
    }

    /**
     * Pre-order traversal of the whole forest.
     */
    public List<AbstractComponent> depthFirst() {
        List<AbstractComponent> order = new ArrayList<>(components.size());
        Deque<AbstractComponent> stack = new ArrayDeque<>();
        List<AbstractComponent> roots = roots();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            AbstractComponent current = stack.pop();
            order.add(current);
            List<String> kids = current.getChildIds();
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(components.get(kids.get(i)));
            }
        }
        return order;
    }

    public List<AbstractComponent> components() {
        return Collections.unmodifiableList(new ArrayList<>(components.values()));
    }

    public int size() {
        return components.size();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }
}
