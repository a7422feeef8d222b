package com.clustermap.model;

/**
 * Counts of one fitting run. {@code resumed} counts regions already converged in the
 * checkpoint; {@code cancelled} is set when dispatch stopped before every region was submitted.
 */
public class FitSummary {
    public final int converged;
    public final int failed;
    public final int skipped;
    public final int resumed;
    public final boolean cancelled;

    public FitSummary(int converged, int failed, int skipped, int resumed, boolean cancelled) {
        this.converged = converged;
        this.failed = failed;
        this.skipped = skipped;
        this.resumed = resumed;
        this.cancelled = cancelled;
    }

    public int totalConverged() { return converged + resumed; }

    @Override
    public String toString() {
        return String.format("converged=%d (resumed %d), failed=%d, skipped=%d%s",
                totalConverged(), resumed, failed, skipped, cancelled ? ", cancelled" : "");
    }
}
