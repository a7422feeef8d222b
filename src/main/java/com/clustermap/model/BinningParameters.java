package com.clustermap.model;

/**
 * Parameters of one adaptive binning run. Pixels with exposure at or below
 * {@code exposureFloor} are excluded; seeds still short of the target beyond
 * {@code maxRadius} become orphans.
 */
public class BinningParameters {
    public final int signalToNoise;
    public final Resolution resolution;
    public final double exposureFloor;
    public final double radiusStep;          // pixels per growth step
    public final double maxRadius;
    public final double backgroundPerPixel;  // expected background counts

    public BinningParameters(int signalToNoise, Resolution resolution, double exposureFloor, double radiusStep,
                             double maxRadius, double backgroundPerPixel) {
        if (signalToNoise <= 0) {
            throw new IllegalArgumentException("Signal-to-noise target must be positive, got " + signalToNoise);
        }
        if (resolution == null) throw new IllegalArgumentException("Resolution is required");
        if (!(radiusStep > 0)) throw new IllegalArgumentException("Radius step must be positive, got " + radiusStep);
        if (!(maxRadius >= 0)) throw new IllegalArgumentException("Radius ceiling must be >= 0, got " + maxRadius);
        if (!(backgroundPerPixel >= 0)) {
            throw new IllegalArgumentException("Background must be >= 0, got " + backgroundPerPixel);
        }
        this.signalToNoise = signalToNoise;
        this.resolution = resolution;
        this.exposureFloor = exposureFloor;
        this.radiusStep = radiusStep;
        this.maxRadius = maxRadius;
        this.backgroundPerPixel = backgroundPerPixel;
    }

    public static BinningParameters of(int signalToNoise, Resolution resolution) {
        return new BinningParameters(signalToNoise, resolution, 0.0, 1.0, 100.0, 0.0);
    }

    public BinningParameters withMaxRadius(double v) {
        return new BinningParameters(signalToNoise, resolution, exposureFloor, radiusStep, v, backgroundPerPixel);
    }

    public BinningParameters withBackgroundPerPixel(double v) {
        return new BinningParameters(signalToNoise, resolution, exposureFloor, radiusStep, maxRadius, v);
    }
}
