package com.glyphforge.grid.fill;

import com.glyphforge.grid.Grid;

/**
 * Decides whether a grid cell belongs to the region being filled.
 */
@FunctionalInterface
public interface CellPredicate {

    boolean test(Grid grid, int x, int y);

    static CellPredicate ofChar(char target) {
        return (grid, x, y) -> grid.get(x, y) == target;
    }

    static CellPredicate ofChars(String chars) {
        return (grid, x, y) -> chars.indexOf(grid.get(x, y)) >= 0;
    }

    default CellPredicate or(CellPredicate other) {
        return (grid, x, y) -> test(grid, x, y) || other.test(grid, x, y);
    }

    default CellPredicate negate() {
        return (grid, x, y) -> !test(grid, x, y);
    }
}
