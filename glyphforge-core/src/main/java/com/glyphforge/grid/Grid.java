/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.grid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Rectangular character grid with a fixed size.
 *
 * <p>Cells are addressed as {@code (x, y)} with {@code x} the column and {@code y}
 * the row, both 0-based. All access is bounds-checked. Rows are never padded
 * implicitly: {@link #fromLines(List)} rejects ragged input and callers that want
 * padding use {@link #fromLinesPadded(List)}.
 */
public final class Grid {

    private final int width;
    private final int height;
    private final char[][] cells;

    public Grid(int width, int height, char fill) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Grid dimensions must be non-negative: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.cells = new char[height][width];
        for (char[] row : cells) {
            Arrays.fill(row, fill);
        }
    }

    /**
     * Builds a grid from equal-length rows.
     *
     * @throws IllegalArgumentException if the rows differ in length
     */
    public static Grid fromLines(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        int width = lines.isEmpty() ? 0 : lines.get(0).length();
        for (int y = 0; y < lines.size(); y++) {
            if (lines.get(y).length() != width) {
                throw new IllegalArgumentException(String.format(
                    "Row %d has length %d, expected %d", y, lines.get(y).length(), width));
            }
        }
        Grid grid = new Grid(width, lines.size(), ' ');
        for (int y = 0; y < lines.size(); y++) {
            lines.get(y).getChars(0, width, grid.cells[y], 0);
        }
        return grid;
    }

    /**
     * Builds a grid from rows of any length, right-padding short rows with spaces.
     */
    public static Grid fromLinesPadded(List<String> lines) {
        int width = 0;
        for (String line : lines) {
            width = Math.max(width, line.length());
        }
        List<String> padded = new ArrayList<>(lines.size());
        for (String line : lines) {
            padded.add(line + " ".repeat(width - line.length()));
        }
        return fromLines(padded);
    }

    /**
     * Splits text on line breaks and pads it into a grid. A single trailing line
     * break does not produce an extra row.
     */
    public static Grid fromText(String text) {
        return fromText(text, Long.MAX_VALUE);
    }

    /**
     * Like {@link #fromText(String)}, but checks the padded size before allocating it.
     *
     * @throws IllegalArgumentException if the padded grid would have more than
     *                                  {@code maxCells} cells
     */
    public static Grid fromText(String text, long maxCells) {
        String normalized = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        if (normalized.isEmpty()) {
            return new Grid(0, 0, ' ');
        }
        List<String> lines = Arrays.asList(normalized.split("\r?\n", -1));
        int width = 0;
        for (String line : lines) {
            width = Math.max(width, line.length());
        }
        if ((long) width * lines.size() > maxCells) {
            throw new IllegalArgumentException(String.format(
                "Grid of %dx%d cells exceeds the maximum of %d cells", width, lines.size(), maxCells));
        }
        return fromLinesPadded(lines);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public long cellCount() {
        return (long) width * height;
    }

    public boolean isInBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public char get(int x, int y) {
        checkBounds(x, y);
        return cells[y][x];
    }

    public void set(int x, int y, char value) {
        checkBounds(x, y);
        cells[y][x] = value;
    }

    /** Row-major cell index, used as the key in cell bitmaps. */
    public int index(int x, int y) {
        checkBounds(x, y);
        return y * width + x;
    }

    public int xOf(int index) {
        return index % width;
    }

    public int yOf(int index) {
        return index / width;
    }

    public String row(int y) {
        checkBounds(0, y);
        return new String(cells[y]);
    }

    public List<String> toLines() {
        List<String> lines = new ArrayList<>(height);
        for (char[] row : cells) {
            lines.add(new String(row));
        }
        return lines;
    }

    /**
     * Copies a rectangular region into a new grid.
     */
    public Grid subGrid(int x, int y, int w, int h) {
        if (w < 0 || h < 0 || x < 0 || y < 0 || x + w > width || y + h > height) {
            throw new IndexOutOfBoundsException(String.format(
                "Region (%d,%d,%dx%d) outside %dx%d grid", x, y, w, h, width, height));
        }
        Grid sub = new Grid(w, h, ' ');
        for (int row = 0; row < h; row++) {
            System.arraycopy(cells[y + row], x, sub.cells[row], 0, w);
        }
        return sub;
    }

    /**
     * Overwrites the region starting at {@code (x, y)} with the contents of {@code source}.
     */
    public void replaceRegion(int x, int y, Grid source) {
        if (x < 0 || y < 0 || x + source.width > width || y + source.height > height) {
            throw new IndexOutOfBoundsException(String.format(
                "Region (%d,%d,%dx%d) outside %dx%d grid", x, y, source.width, source.height, width, height));
        }
        for (int row = 0; row < source.height; row++) {
            System.arraycopy(source.cells[row], 0, cells[y + row], x, source.width);
        }
    }

    public Grid copy() {
        return subGrid(0, 0, width, height);
    }

    private void checkBounds(int x, int y) {
        if (!isInBounds(x, y)) {
            throw new IndexOutOfBoundsException(String.format(
                "Cell (%d,%d) outside %dx%d grid", x, y, width, height));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid other)) return false;
        return width == other.width && height == other.height && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height, Arrays.deepHashCode(cells));
    }

    @Override
    public String toString() {
        return String.join("\n", toLines());
    }
}
