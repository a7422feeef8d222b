package com.clustermap.model;

/**
 * A frozen adaptive bin. Ids are positive and follow freeze order; the seed pixel is also the
 * centroid used for merges. {@code pixelCount} includes the pixels absorbed after freezing.
 */
public class Region {
    public final int id;
    public final int centerX;
    public final int centerY;
    public final double radius;
    public final double signalToNoise;
    public final int pixelCount;
    public final int absorbedPixels;
    private final double[] growthTrace;

    public Region(int id, int centerX, int centerY, double radius, double signalToNoise,
                  int pixelCount, int absorbedPixels, double[] growthTrace) {
        this.id = id;
        this.centerX = centerX;
        this.centerY = centerY;
        this.radius = radius;
        this.signalToNoise = signalToNoise;
        this.pixelCount = pixelCount;
        this.absorbedPixels = absorbedPixels;
        this.growthTrace = growthTrace == null ? new double[0] : growthTrace.clone();
    }

    /**
     * S/N after each growth step, ending with the freezing step. Without background the
     * sequence never decreases; with background an added pixel without counts can lower it.
     */
    public double[] growthTrace() { return growthTrace.clone(); }

    public boolean covers(int x, int y) {
        double dx = x - centerX, dy = y - centerY;
        return dx * dx + dy * dy <= radius * radius;
    }
}
