package com.clustermap.model;

/**
 * Spatial resolution of the adaptive binning. The cell size is the spacing of the seed
 * lattice in pixels; finer resolutions give more regions and longer fitting runs.
 */
public enum Resolution {
    COARSE(1, 5),
    MEDIUM(2, 3),
    FINE(3, 1);

    private final int level;
    private final int cellSize;

    Resolution(int level, int cellSize) {
        this.level = level;
        this.cellSize = cellSize;
    }

    /** Level as written in cluster configuration files (1 = low, 2 = medium, 3 = high). */
    public int level() { return level; }

    public int cellSize() { return cellSize; }

    public static Resolution fromLevel(int level) {
        for (Resolution r : values()) {
            if (r.level == level) return r;
        }
        throw new IllegalArgumentException("Unknown resolution level " + level + " (expected 1, 2 or 3)");
    }
}
