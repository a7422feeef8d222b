package com.clustermap.model;

import java.time.Duration;

/**
 * Settings of the parallel fitting stage. A fit running longer than {@code fitTimeout} is
 * interrupted and recorded as failed; regions whose summed net counts fall below
 * {@code minimumNetCounts} are not fitted.
 */
public class FitPoolSettings {
    public final int workers;
    public final Duration fitTimeout;
    public final double startTemperature; // keV
    public final double minimumNetCounts;

    public FitPoolSettings(int workers, Duration fitTimeout, double startTemperature, double minimumNetCounts) {
        if (workers <= 0) throw new IllegalArgumentException("Worker count must be positive, got " + workers);
        if (fitTimeout == null || fitTimeout.isNegative() || fitTimeout.isZero()) {
            throw new IllegalArgumentException("Fit timeout must be positive");
        }
        if (!(startTemperature > 0)) {
            throw new IllegalArgumentException("Start temperature must be positive, got " + startTemperature);
        }
        this.workers = workers;
        this.fitTimeout = fitTimeout;
        this.startTemperature = startTemperature;
        this.minimumNetCounts = minimumNetCounts;
    }

    public static FitPoolSettings withWorkers(int workers) {
        return new FitPoolSettings(workers, Duration.ofMinutes(10), 5.0, 1.0);
    }

    public FitPoolSettings withFitTimeout(Duration v) {
        return new FitPoolSettings(workers, v, startTemperature, minimumNetCounts);
    }
}
