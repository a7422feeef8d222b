package com.clustermap.model;

import java.util.Objects;

/**
 * Last stage a cluster completed. Stages take a state and return the next one; nothing
 * mutates it in place.
 */
public class PipelineState {
    public final String clusterName;
    public final int lastCompletedStage;

    public PipelineState(String clusterName, int lastCompletedStage) {
        if (clusterName == null || clusterName.isBlank()) throw new IllegalArgumentException("Cluster name is required");
        if (lastCompletedStage < 0 || lastCompletedStage > PipelineStage.values().length) {
            throw new IllegalArgumentException("Invalid last completed stage " + lastCompletedStage);
        }
        this.clusterName = clusterName;
        this.lastCompletedStage = lastCompletedStage;
    }

    public static PipelineState initial(String clusterName) {
        return new PipelineState(clusterName, 0);
    }

    public boolean hasCompleted(PipelineStage stage) {
        return lastCompletedStage >= stage.number();
    }

    /** Completing an earlier stage again never moves the counter backwards. */
    public PipelineState completed(PipelineStage stage) {
        return new PipelineState(clusterName, Math.max(lastCompletedStage, stage.number()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PipelineState)) return false;
        PipelineState other = (PipelineState) o;
        return lastCompletedStage == other.lastCompletedStage && clusterName.equals(other.clusterName);
    }

    @Override
    public int hashCode() { return Objects.hash(clusterName, lastCompletedStage); }

    @Override
    public String toString() { return clusterName + " after stage " + lastCompletedStage; }
}
