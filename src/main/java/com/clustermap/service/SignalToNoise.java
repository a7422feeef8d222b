package com.clustermap.service;

/**
 * Poisson signal-to-noise of a set of pixels.
 */
public final class SignalToNoise {

    private SignalToNoise() {}

    /**
     * {@code (S - B) / sqrt(S + B)} for summed counts {@code S} and expected background
     * counts {@code B}. Zero when nothing was counted.
     * <p>
     * Adding pixels never lowers the value when {@code B} is zero. With background, a pixel
     * without counts raises {@code B} and can lower it: S=10 gives 2.71 with B=1 and 2.31
     * with B=2.
     */
    public static double of(double counts, double background) {
        double variance = counts + background;
        if (variance <= 0) return 0.0;
        return (counts - background) / Math.sqrt(variance);
    }
}
