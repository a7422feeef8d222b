package com.clustermap.model;

/**
 * An orphan seed that could not reach the target S/N below the radius ceiling and was
 * folded into the nearest frozen region.
 */
public class MergeEvent {
    public final Pixel orphanSeed;
    public final int targetRegionId;
    public final int pixelsAbsorbed;
    public final double distance;
    public final double orphanSignalToNoise;

    public MergeEvent(Pixel orphanSeed, int targetRegionId, int pixelsAbsorbed, double distance,
                      double orphanSignalToNoise) {
        this.orphanSeed = orphanSeed;
        this.targetRegionId = targetRegionId;
        this.pixelsAbsorbed = pixelsAbsorbed;
        this.distance = distance;
        this.orphanSignalToNoise = orphanSignalToNoise;
    }

    @Override
    public String toString() {
        return "orphan " + orphanSeed + " -> region " + targetRegionId + " (" + pixelsAbsorbed + " pixels)";
    }
}
