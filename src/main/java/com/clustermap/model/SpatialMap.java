package com.clustermap.model;

import ij.process.FloatProcessor;
import ij.process.ImageStatistics;

/**
 * A per-pixel map of one derived quantity. Pixels without data hold {@link #NO_DATA},
 * so excluded pixels stay distinguishable from zero-valued ones.
 */
public class SpatialMap {

    public static final float NO_DATA = Float.NaN;

    private final String name;
    private final String unit;
    private final float[][] values;

    public SpatialMap(String name, String unit, float[][] values) {
        if (values == null || values.length == 0 || values[0].length == 0) {
            throw new IllegalArgumentException("Map '" + name + "' is empty");
        }
        this.name = name;
        this.unit = unit == null ? "" : unit;
        this.values = PixelGrid.copy(values);
    }

    public String name() { return name; }
    public String unit() { return unit; }
    public int width() { return values[0].length; }
    public int height() { return values.length; }

    public float valueAt(int x, int y) { return values[y][x]; }

    public boolean hasData(int x, int y) { return !Float.isNaN(values[y][x]); }

    public float[][] values() { return PixelGrid.copy(values); }

    /** ImageJ view of the map, row-major as ImageJ expects. */
    public FloatProcessor toProcessor() {
        int w = width(), h = height();
        float[] px = new float[w * h];
        for (int y = 0; y < h; y++) System.arraycopy(values[y], 0, px, y * w, w);
        return new FloatProcessor(w, h, px);
    }

    /** Statistics over pixels with data; ImageJ skips NaN pixels. */
    public ImageStatistics statistics() {
        return toProcessor().getStatistics();
    }
}
