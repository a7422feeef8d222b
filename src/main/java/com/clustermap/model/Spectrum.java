package com.clustermap.model;

/**
 * Spectrum extracted for one region from one observation.
 */
public class Spectrum {
    public final int regionId;
    public final String observationId;
    public final double[] channelCounts;
    public final double[] backgroundCounts;
    public final double exposureTime; // seconds

    public Spectrum(int regionId, String observationId, double[] channelCounts, double[] backgroundCounts, double exposureTime) {
        if (channelCounts == null) throw new IllegalArgumentException("Channel counts are required");
        if (backgroundCounts != null && backgroundCounts.length != channelCounts.length) {
            throw new IllegalArgumentException("Background spectrum has " + backgroundCounts.length
                    + " channels, source has " + channelCounts.length);
        }
        this.regionId = regionId;
        this.observationId = observationId;
        this.channelCounts = channelCounts.clone();
        this.backgroundCounts = backgroundCounts == null ? new double[channelCounts.length] : backgroundCounts.clone();
        this.exposureTime = exposureTime;
    }

    public int channels() { return channelCounts.length; }

    public double totalCounts() {
        double s = 0;
        for (double c : channelCounts) s += c;
        return s;
    }

    public double netCounts() {
        double s = 0;
        for (int i = 0; i < channelCounts.length; i++) s += channelCounts[i] - backgroundCounts[i];
        return s;
    }
}
