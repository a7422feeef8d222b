package com.clustermap.service;

import com.clustermap.model.FitRequest;
import com.clustermap.model.PlasmaFitResult;

/**
 * Fits an absorbed thermal plasma model to a region's spectra by minimising the fit
 * statistic. Implementations wrap an external optimizer and must report non-convergence
 * through {@link PlasmaFitResult#converged()} rather than returning default parameters.
 * Called concurrently from fitting workers; implementations must be thread-safe and should
 * honour thread interruption so overdue fits can be abandoned.
 */
public interface PlasmaModelFitter {

    PlasmaFitResult fit(FitRequest request) throws Exception;
}
