/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.analysis.containment;

import com.glyphforge.api.model.BoundingBox;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds the containment hierarchy of a set of bounding boxes.
 *
 * <p>Box {@code i} contains box {@code j} when it encloses {@code j} strictly on all four
 * sides. The relation is a strict partial order, so the graph is acyclic. The transitive
 * reduction keeps edge {@code i -> j} only when no {@code k} satisfies
 * {@code i -> k -> j}; closure rows are kept as bitmaps.
 *
 * <p>Overlapping containers can give a node two direct containers. The tighter one (smaller
 * area, then lower index) becomes the primary parent so the result is always a forest.
 */
public class ContainmentClusterer {
    private static final Logger logger = Logger.getLogger(ContainmentClusterer.class.getName());

    public ContainmentGraph cluster(List<BoundingBox> boxes) {
        int n = boxes.size();
        List<ContainmentEdge> raw = new ArrayList<>();
        RoaringBitmap[] contains = new RoaringBitmap[n];

        for (int i = 0; i < n; i++) {
            contains[i] = new RoaringBitmap();
            BoundingBox outer = boxes.get(i);
            for (int j = 0; j < n; j++) {
                if (i != j && outer.strictlyContains(boxes.get(j))) {
                    contains[i].add(j);
                    raw.add(new ContainmentEdge(i, j, score(outer, boxes.get(j))));
                }
            }
        }

        RoaringBitmap[] closure = transitiveClosure(contains);

        List<ContainmentEdge> reduced = new ArrayList<>();
        for (ContainmentEdge edge : raw) {
            if (!isImplied(edge.container(), edge.contained(), closure)) {
                reduced.add(edge);
            }
        }

        int[] parents = new int[n];
        Arrays.fill(parents, ContainmentGraph.VIRTUAL_ROOT);
        for (ContainmentEdge edge : reduced) {
            int current = parents[edge.contained()];
            if (current == ContainmentGraph.VIRTUAL_ROOT
                || boxes.get(edge.container()).area() < boxes.get(current).area()) {
                parents[edge.contained()] = edge.container();
            }
        }

        logger.fine(() -> String.format("Containment: %d nodes, %d raw edges, %d reduced edges",
            n, raw.size(), reduced.size()));
        return new ContainmentGraph(n, raw, reduced, parents);
    }

    static double score(BoundingBox container, BoundingBox contained) {
        return (double) contained.area() / container.area();
    }

    // Warshall over bitmap rows
    private static RoaringBitmap[] transitiveClosure(RoaringBitmap[] adjacency) {
        int n = adjacency.length;
        RoaringBitmap[] closure = new RoaringBitmap[n];
        for (int i = 0; i < n; i++) {
            closure[i] = adjacency[i].clone();
        }
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                if (closure[i].contains(k)) {
                    closure[i].or(closure[k]);
                }
            }
        }
        return closure;
    }

    private static boolean isImplied(int from, int to, RoaringBitmap[] closure) {
        RoaringBitmap via = closure[from];
        var it = via.getIntIterator();
        while (it.hasNext()) {
            int k = it.next();
            if (k != to && closure[k].contains(to)) {
                return true;
            }
        }
        return false;
    }
}
