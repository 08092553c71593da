package com.glyphforge.grid.fill;

/**
 * Neighbourhood used when growing regions.
 */
public enum Connectivity {
    FOUR(new int[][]{{1, 0}, {-1, 0}, {0, 1}, {0, -1}}),
    EIGHT(new int[][]{{1, 0}, {-1, 0}, {0, 1}, {0, -1}, {1, 1}, {1, -1}, {-1, 1}, {-1, -1}});

    private final int[][] offsets;

    Connectivity(int[][] offsets) {
        this.offsets = offsets;
    }

    int[][] offsets() {
        return offsets;
    }

    public int neighbourCount() {
        return offsets.length;
    }

    public static Connectivity of(int neighbours) {
        return switch (neighbours) {
            case 4 -> FOUR;
            case 8 -> EIGHT;
            default -> throw new IllegalArgumentException("Connectivity must be 4 or 8, got " + neighbours);
        };
    }
}
