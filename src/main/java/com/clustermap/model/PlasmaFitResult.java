package com.clustermap.model;

/**
 * Best-fit parameters returned by the optimizer. Normalization is per unit exposure of the
 * spectra; the fitting stage applies the region's exposure correction.
 */
public class PlasmaFitResult {
    public final ParameterEstimate temperature;
    public final ParameterEstimate abundance;
    public final ParameterEstimate normalization;
    public final int dof;
    public final double statistic;
    public final boolean converged;

    public PlasmaFitResult(ParameterEstimate temperature, ParameterEstimate abundance, ParameterEstimate normalization,
                           int dof, double statistic, boolean converged) {
        this.temperature = temperature;
        this.abundance = abundance;
        this.normalization = normalization;
        this.dof = dof;
        this.statistic = statistic;
        this.converged = converged;
    }

    public static PlasmaFitResult notConverged(int dof, double statistic) {
        return new PlasmaFitResult(ParameterEstimate.MISSING, ParameterEstimate.MISSING, ParameterEstimate.MISSING,
                dof, statistic, false);
    }
}
