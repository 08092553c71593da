/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.analysis.containment;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Containment relation over a list of components, identified by their list index.
 *
 * <p>Holds both the raw strict-containment edges and their transitive reduction. Each
 * node's primary parent is its tightest direct container; the primary parents form the
 * containment forest. When more than one root exists, {@link #toTree()} hangs them under
 * a virtual root with index {@link #VIRTUAL_ROOT}.
 */
public final class ContainmentGraph {

    public static final int VIRTUAL_ROOT = -1;

    private final int size;
    private final List<ContainmentEdge> rawEdges;
    private final List<ContainmentEdge> reducedEdges;
    private final int[] parents;
    private final List<IntList> children;
    private final IntList roots;

    ContainmentGraph(int size, List<ContainmentEdge> rawEdges, List<ContainmentEdge> reducedEdges, int[] parents) {
        this.size = size;
        this.rawEdges = Collections.unmodifiableList(rawEdges);
        this.reducedEdges = Collections.unmodifiableList(reducedEdges);
        this.parents = parents;

        List<IntList> childLists = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            childLists.add(new IntArrayList());
        }
        IntArrayList rootList = new IntArrayList();
        for (int i = 0; i < size; i++) {
            if (parents[i] == VIRTUAL_ROOT) {
                rootList.add(i);
            } else {
                childLists.get(parents[i]).add(i);
            }
        }
        List<IntList> frozen = new ArrayList<>(size);
        for (IntList list : childLists) {
            frozen.add(IntLists.unmodifiable(list));
        }
        this.children = frozen;
        this.roots = IntLists.unmodifiable(rootList);
    }

    public int size() {
        return size;
    }

    /** Every strict-containment pair, before reduction. */
    public List<ContainmentEdge> rawEdges() {
        return rawEdges;
    }

    /** Edges that survive transitive reduction. */
    public List<ContainmentEdge> reducedEdges() {
        return reducedEdges;
    }

    /** Nodes that no other node contains, in index order. */
    public IntList roots() {
        return roots;
    }

    /** Children of {@code node} in the containment forest, in index order. */
    public IntList children(int node) {
        return children.get(node);
    }

    /**
     * Primary parent of {@code node}, or {@link #VIRTUAL_ROOT} if it is a root.
     */
    public int parent(int node) {
        return parents[node];
    }

    public boolean hasEdge(int container, int contained) {
        for (ContainmentEdge edge : reducedEdges) {
            if (edge.container() == container && edge.contained() == contained) {
                return true;
            }
        }
        return false;
    }

    /**
     * Depth of {@code node} in the forest; roots have depth 0.
     */
    public int depth(int node) {
        int depth = 0;
        for (int p = parents[node]; p != VIRTUAL_ROOT; p = parents[p]) {
            depth++;
        }
        return depth;
    }

    /**
     * The forest as a single tree. A lone root is returned as is; several roots are
     * wrapped in a node whose index is {@link #VIRTUAL_ROOT}.
     */
    public Node toTree() {
        if (roots.size() == 1) {
            return buildNode(roots.getInt(0));
        }
        List<Node> top = new ArrayList<>(roots.size());
        for (int i = 0; i < roots.size(); i++) {
            top.add(buildNode(roots.getInt(i)));
        }
        return new Node(VIRTUAL_ROOT, top);
    }

    private Node buildNode(int index) {
        IntList kids = children.get(index);
        List<Node> childNodes = new ArrayList<>(kids.size());
        for (int i = 0; i < kids.size(); i++) {
            childNodes.add(buildNode(kids.getInt(i)));
        }
        return new Node(index, childNodes);
    }

    /**
     * Node of the containment tree.
     */
    public record Node(int index, List<Node> children) {

        public Node {
            children = List.copyOf(children);
        }

        public boolean isVirtualRoot() {
            return index == VIRTUAL_ROOT;
        }
    }
}
