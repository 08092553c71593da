/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.grid.fill;

import com.glyphforge.api.model.BoundingBox;
import com.glyphforge.api.model.Cell;
import com.glyphforge.api.model.ComponentView;
import com.glyphforge.grid.Grid;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A connected region of grid cells together with its derived geometry.
 *
 * <p>Cells are stored as row-major indices in a {@link RoaringBitmap}. A cell is on the
 * boundary when at least one of its neighbours (under the fill connectivity) lies outside
 * the region or outside the grid; all remaining cells are interior. Boundary and interior
 * always partition the region.
 *
 * <p>Content lines cover the bounding box row by row, with cells outside the region
 * rendered as spaces and trailing spaces trimmed.
 */
public final class GridComponent {

    private final int gridWidth;
    private final RoaringBitmap cells;
    private final RoaringBitmap boundary;
    private final RoaringBitmap interior;
    private final BoundingBox bounds;
    private final SortedMap<Character, Integer> content;
    private final List<String> contentLines;

    private GridComponent(int gridWidth, RoaringBitmap cells, RoaringBitmap boundary, RoaringBitmap interior,
                          BoundingBox bounds, SortedMap<Character, Integer> content, List<String> contentLines) {
        this.gridWidth = gridWidth;
        this.cells = cells;
        this.boundary = boundary;
        this.interior = interior;
        this.bounds = bounds;
        this.content = content;
        this.contentLines = contentLines;
    }

    /**
     * Builds a component from a non-empty set of cell indices of {@code grid}.
     */
    public static GridComponent of(Grid grid, RoaringBitmap region, Connectivity connectivity) {
        if (region.isEmpty()) {
            throw new IllegalArgumentException("Component region must not be empty");
        }
        int width = grid.width();
        RoaringBitmap boundary = new RoaringBitmap();
        RoaringBitmap interior = new RoaringBitmap();
        TreeMap<Character, Integer> content = new TreeMap<>();
        int xMin = Integer.MAX_VALUE;
        int yMin = Integer.MAX_VALUE;
        int xMax = Integer.MIN_VALUE;
        int yMax = Integer.MIN_VALUE;

        IntIterator it = region.getIntIterator();
        while (it.hasNext()) {
            int index = it.next();
            int x = index % width;
            int y = index / width;
            xMin = Math.min(xMin, x);
            yMin = Math.min(yMin, y);
            xMax = Math.max(xMax, x);
            yMax = Math.max(yMax, y);
            content.merge(grid.get(x, y), 1, Integer::sum);

            boolean edge = false;
            for (int[] offset : connectivity.offsets()) {
                int nx = x + offset[0];
                int ny = y + offset[1];
                if (!grid.isInBounds(nx, ny) || !region.contains(ny * width + nx)) {
                    edge = true;
                    break;
                }
            }
            if (edge) {
                boundary.add(index);
            } else {
                interior.add(index);
            }
        }

        BoundingBox bounds = new BoundingBox(xMin, yMin, xMax, yMax);
        List<String> lines = new ArrayList<>(bounds.height());
        StringBuilder sb = new StringBuilder(bounds.width());
        for (int y = yMin; y <= yMax; y++) {
            sb.setLength(0);
            for (int x = xMin; x <= xMax; x++) {
                sb.append(region.contains(y * width + x) ? grid.get(x, y) : ' ');
            }
            lines.add(sb.toString().stripTrailing());
        }

        return new GridComponent(width, region.clone(), boundary, interior, bounds,
            Collections.unmodifiableSortedMap(content), Collections.unmodifiableList(lines));
    }

    public BoundingBox bounds() {
        return bounds;
    }

    public int cellCount() {
        return cells.getCardinality();
    }

    public int boundaryCount() {
        return boundary.getCardinality();
    }

    public int interiorCount() {
        return interior.getCardinality();
    }

    public boolean containsCell(int x, int y) {
        return x >= 0 && x < gridWidth && cells.contains(y * gridWidth + x);
    }

    /** Copy of the region's cell indices. */
    public RoaringBitmap cellIndices() {
        return cells.clone();
    }

    public List<Cell> boundaryCells() {
        return toCells(boundary);
    }

    public List<Cell> interiorCells() {
        return toCells(interior);
    }

    /** Character histogram of the region, ordered by character. */
    public SortedMap<Character, Integer> content() {
        return content;
    }

    public int countChars(String chars) {
        int total = 0;
        for (var entry : content.entrySet()) {
            if (chars.indexOf(entry.getKey()) >= 0) {
                total += entry.getValue();
            }
        }
        return total;
    }

    public List<String> contentLines() {
        return contentLines;
    }

    public ComponentView toView(String id) {
        return new ComponentView(id, bounds, contentLines);
    }

    private List<Cell> toCells(RoaringBitmap bitmap) {
        List<Cell> result = new ArrayList<>(bitmap.getCardinality());
        bitmap.forEach((int index) -> result.add(new Cell(index % gridWidth, index / gridWidth)));
        return result;
    }

    @Override
    public String toString() {
        return "GridComponent{bounds=" + bounds + ", cells=" + cellCount() + "}";
    }
}
