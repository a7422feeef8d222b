package com.clustermap.model;

import java.util.List;

/**
 * Input of one plasma model fit. Temperatures are in keV, abundance relative to solar;
 * redshift and nH (10^22 cm^-2) are frozen.
 */
public class FitRequest {
    public final int regionId;
    public final List<Spectrum> spectra;
    public final double startTemperature;
    public final double startAbundance;
    public final double redshift;
    public final double hydrogenColumnDensity;

    public FitRequest(int regionId, List<Spectrum> spectra, double startTemperature, double startAbundance,
                      double redshift, double hydrogenColumnDensity) {
        this.regionId = regionId;
        this.spectra = List.copyOf(spectra);
        this.startTemperature = startTemperature;
        this.startAbundance = startAbundance;
        this.redshift = redshift;
        this.hydrogenColumnDensity = hydrogenColumnDensity;
    }

    public double netCounts() {
        double s = 0;
        for (Spectrum sp : spectra) s += sp.netCounts();
        return s;
    }
}
