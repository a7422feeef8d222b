package com.clustermap.model;

/**
 * Co-registered photon counts and exposure of one cluster image, indexed {@code [y][x]}.
 * Owned by the caller; the engine only reads it.
 */
public class PixelGrid {

    private final int[][] counts;
    private final float[][] exposure;
    private final CoordinateReference reference;
    private final int width;
    private final int height;

    public PixelGrid(int[][] counts, float[][] exposure, CoordinateReference reference) {
        if (counts == null || exposure == null) throw new IllegalArgumentException("Counts and exposure are required");
        if (counts.length == 0 || counts[0].length == 0) throw new IllegalArgumentException("Counts image is empty");
        this.height = counts.length;
        this.width = counts[0].length;
        if (exposure.length != height) {
            throw new IllegalArgumentException(String.format(
                    "Exposure map has %d rows, counts image has %d", exposure.length, height));
        }
        for (int y = 0; y < height; y++) {
            if (counts[y].length != width || exposure[y].length != width) {
                throw new IllegalArgumentException("Counts and exposure rows differ in length at row " + y);
            }
        }
        this.counts = copy(counts);
        this.exposure = copy(exposure);
        this.reference = reference != null ? reference : CoordinateReference.PIXEL;
    }

    public PixelGrid(int[][] counts, float[][] exposure) {
        this(counts, exposure, CoordinateReference.PIXEL);
    }

    public int width() { return width; }
    public int height() { return height; }
    public CoordinateReference reference() { return reference; }

    public int countsAt(int x, int y) { return counts[y][x]; }
    public float exposureAt(int x, int y) { return exposure[y][x]; }

    public int[][] counts() { return copy(counts); }
    public float[][] exposure() { return copy(exposure); }

    public boolean sameShape(float[][] other) {
        if (other == null || other.length != height) return false;
        for (float[] row : other) {
            if (row.length != width) return false;
        }
        return true;
    }

    static int[][] copy(int[][] src) {
        int[][] d = new int[src.length][];
        for (int i = 0; i < src.length; i++) d[i] = src[i].clone();
        return d;
    }

    static float[][] copy(float[][] src) {
        float[][] d = new float[src.length][];
        for (int i = 0; i < src.length; i++) d[i] = src[i].clone();
        return d;
    }
}
