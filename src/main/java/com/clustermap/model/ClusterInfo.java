package com.clustermap.model;

import java.util.List;

/**
 * Physical description of the observed cluster. Redshift and nH (10^22 cm^-2) are frozen in
 * the plasma fit; the abundance is its starting value relative to solar. Every observation
 * contributes events to every region.
 */
public class ClusterInfo {
    public final String name;
    public final List<String> observationIds;
    public final double redshift;
    public final double hydrogenColumnDensity;
    public final double abundance;
    public final int signalToNoise;

    public ClusterInfo(String name, List<String> observationIds, double redshift, double hydrogenColumnDensity,
                       double abundance, int signalToNoise) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Cluster name is required");
        if (observationIds == null || observationIds.isEmpty()) {
            throw new IllegalArgumentException("At least one observation id is required");
        }
        if (redshift < 0) throw new IllegalArgumentException("Redshift must be >= 0, got " + redshift);
        if (hydrogenColumnDensity < 0) throw new IllegalArgumentException("nH must be >= 0, got " + hydrogenColumnDensity);
        if (signalToNoise <= 0) throw new IllegalArgumentException("Signal-to-noise must be positive, got " + signalToNoise);
        this.name = name;
        this.observationIds = List.copyOf(observationIds);
        this.redshift = redshift;
        this.hydrogenColumnDensity = hydrogenColumnDensity;
        this.abundance = abundance;
        this.signalToNoise = signalToNoise;
    }

    public ClusterInfo(String name, List<String> observationIds, double redshift, double hydrogenColumnDensity, double abundance) {
        this(name, observationIds, redshift, hydrogenColumnDensity, abundance, 50);
    }
}
