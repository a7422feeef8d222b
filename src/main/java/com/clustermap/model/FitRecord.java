package com.clustermap.model;

import java.util.Objects;

/**
 * Outcome of fitting one region. Written once to the fit table and never changed.
 * {@code reason} says why the region failed or was skipped; it is empty for converged fits
 * and not persisted.
 */
public class FitRecord {

    public enum Status { CONVERGED, FAILED, SKIPPED }

    public final int regionId;
    public final ParameterEstimate temperature;
    public final ParameterEstimate abundance;
    public final ParameterEstimate normalization;
    public final int dof;
    public final double statistic;
    public final Status status;
    public final String reason;

    public FitRecord(int regionId, ParameterEstimate temperature, ParameterEstimate abundance,
                     ParameterEstimate normalization, int dof, double statistic, Status status, String reason) {
        if (regionId <= 0) throw new IllegalArgumentException("Region id must be positive, got " + regionId);
        if (status == null) throw new IllegalArgumentException("Status is required");
        this.regionId = regionId;
        this.temperature = temperature != null ? temperature : ParameterEstimate.MISSING;
        this.abundance = abundance != null ? abundance : ParameterEstimate.MISSING;
        this.normalization = normalization != null ? normalization : ParameterEstimate.MISSING;
        this.dof = dof;
        this.statistic = statistic;
        this.status = status;
        this.reason = reason != null ? reason : "";
    }

    public static FitRecord failed(int regionId, String reason) {
        return new FitRecord(regionId, null, null, null, 0, Double.NaN, Status.FAILED, reason);
    }

    public static FitRecord skipped(int regionId, String reason) {
        return new FitRecord(regionId, null, null, null, 0, Double.NaN, Status.SKIPPED, reason);
    }

    public boolean isConverged() { return status == Status.CONVERGED; }

    /** Reduced fit statistic, NaN without degrees of freedom. */
    public double reducedStatistic() { return dof > 0 ? statistic / dof : Double.NaN; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FitRecord)) return false;
        FitRecord other = (FitRecord) o;
        return regionId == other.regionId && dof == other.dof
                && Double.compare(statistic, other.statistic) == 0
                && status == other.status
                && temperature.equals(other.temperature)
                && abundance.equals(other.abundance)
                && normalization.equals(other.normalization)
                && reason.equals(other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regionId, temperature, abundance, normalization, dof, statistic, status, reason);
    }

    @Override
    public String toString() {
        return "region " + regionId + " " + status + (reason.isEmpty() ? "" : " (" + reason + ")")
                + ", kT=" + temperature;
    }
}
