/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.grid.fill;

import com.glyphforge.grid.Grid;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Grows connected regions of matching cells.
 *
 * <p>Uses an explicit work stack and a visited bitmap, so region size is bounded only by
 * the grid and never by call depth. Components are discovered in row-major order of their
 * first cell, which makes the output order deterministic.
 *
 * <p>Instances are stateless and thread-safe.
 */
public class FloodFillEngine {
    private static final Logger logger = Logger.getLogger(FloodFillEngine.class.getName());

    private final Connectivity connectivity;

    public FloodFillEngine() {
        this(Connectivity.FOUR);
    }

    public FloodFillEngine(Connectivity connectivity) {
        this.connectivity = connectivity;
    }

    public Connectivity connectivity() {
        return connectivity;
    }

    /**
     * Returns the region of cells equal to {@code target} that is connected to the start
     * cell, or an empty bitmap when the start cell does not hold {@code target}.
     *
     * @throws IndexOutOfBoundsException if the start cell is outside the grid
     */
    public RoaringBitmap fillRegion(Grid grid, int x, int y, char target) {
        return fillRegion(grid, x, y, CellPredicate.ofChar(target));
    }

    public RoaringBitmap fillRegion(Grid grid, int x, int y, CellPredicate predicate) {
        int start = grid.index(x, y);
        if (!predicate.test(grid, x, y)) {
            return new RoaringBitmap();
        }
        return grow(grid, start, predicate, new RoaringBitmap());
    }

    /**
     * Replaces every cell of the region connected to {@code (x, y)} that holds
     * {@code target} with {@code replacement}.
     *
     * @return number of cells replaced
     */
    public int floodFill(Grid grid, int x, int y, char target, char replacement) {
        RoaringBitmap region = fillRegion(grid, x, y, target);
        region.forEach((int index) -> grid.set(grid.xOf(index), grid.yOf(index), replacement));
        return region.getCardinality();
    }

    /**
     * Finds every maximal connected region of cells equal to {@code target}.
     */
    public List<GridComponent> findConnectedComponents(Grid grid, char target) {
        return findConnectedComponents(grid, CellPredicate.ofChar(target));
    }

    /**
     * Finds every maximal connected region of cells accepted by {@code predicate}.
     * The regions are pairwise disjoint and together cover exactly the accepted cells.
     */
    public List<GridComponent> findConnectedComponents(Grid grid, CellPredicate predicate) {
        List<GridComponent> components = new ArrayList<>();
        RoaringBitmap visited = new RoaringBitmap();

        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                int index = y * grid.width() + x;
                if (visited.contains(index) || !predicate.test(grid, x, y)) {
                    continue;
                }
                RoaringBitmap region = grow(grid, index, predicate, visited);
                components.add(GridComponent.of(grid, region, connectivity));
            }
        }

        logger.fine(() -> String.format("Found %d components in %dx%d grid",
            components.size(), grid.width(), grid.height()));
        return components;
    }

    private RoaringBitmap grow(Grid grid, int start, CellPredicate predicate, RoaringBitmap visited) {
        RoaringBitmap region = new RoaringBitmap();
        IntArrayList stack = new IntArrayList();
        int width = grid.width();

        visited.add(start);
        stack.push(start);
        while (!stack.isEmpty()) {
            int index = stack.popInt();
            region.add(index);
            int cx = index % width;
            int cy = index / width;
            for (int[] offset : connectivity.offsets()) {
                int nx = cx + offset[0];
                int ny = cy + offset[1];
                if (!grid.isInBounds(nx, ny)) {
                    continue;
                }
                int neighbour = ny * width + nx;
                if (!visited.contains(neighbour) && predicate.test(grid, nx, ny)) {
                    visited.add(neighbour);
                    stack.push(neighbour);
                }
            }
        }
        return region;
    }
}
