package com.clustermap.service;

import com.clustermap.exceptions.SpectrumExtractionException;
import com.clustermap.model.Pixel;
import com.clustermap.model.Spectrum;

import java.util.List;

/**
 * Extracts the spectrum of a set of sky pixels from one observation's events. Implementations
 * know the event and response formats; the fitting stage only sees {@link Spectrum}s.
 * Called concurrently from fitting workers, so implementations must be thread-safe.
 */
public interface SpectrumExtractor {

    Spectrum extract(int regionId, List<Pixel> pixels, String observationId) throws SpectrumExtractionException;
}
