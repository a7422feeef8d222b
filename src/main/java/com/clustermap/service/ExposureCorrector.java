package com.clustermap.service;

import com.clustermap.model.ExposureCorrectionTable;
import com.clustermap.model.Pixel;
import com.clustermap.model.Region;
import com.clustermap.model.RegionIndexMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Effective exposure of each region across overlapping observations.
 * <p>
 * For every observation the mean exposure over the region's pixels is taken; the factor is
 * the sum of those means divided by the sum of the observations' peak exposures, i.e. the
 * fraction of full-depth exposure the region received. A region no observation covers is
 * invalid and gets no factor.
 */
public class ExposureCorrector {

    private static final Logger logger = LoggerFactory.getLogger(ExposureCorrector.class);

    /**
     * @param observationExposure exposure map per observation id, each the shape of the index map
     */
    public ExposureCorrectionTable correct(RegionIndexMap index, Map<String, float[][]> observationExposure) {
        if (index == null) throw new IllegalArgumentException("Region index map is required");
        if (observationExposure == null || observationExposure.isEmpty()) {
            throw new IllegalArgumentException("At least one observation exposure map is required");
        }

        double peakSum = 0;
        for (Map.Entry<String, float[][]> e : observationExposure.entrySet()) {
            if (!index.sameShape(e.getValue())) {
                throw new IllegalArgumentException("Exposure map of observation " + e.getKey()
                        + " does not match the " + index.width() + "x" + index.height() + " region index map");
            }
            peakSum += peak(e.getValue());
        }

        Map<Integer, Double> factors = new LinkedHashMap<>();
        Set<Integer> invalid = new HashSet<>();
        for (Region region : index.regions()) {
            List<Pixel> pixels = index.pixelsOf(region.id);
            double aggregate = 0;
            int covering = 0;
            for (float[][] exposure : observationExposure.values()) {
                double mean = meanOver(exposure, pixels);
                if (mean > 0) {
                    aggregate += mean;
                    covering++;
                }
            }
            if (aggregate > 0 && peakSum > 0) {
                factors.put(region.id, aggregate / peakSum);
                logger.debug("Region {}: {} covering observations, factor {}", region.id, covering, aggregate / peakSum);
            } else {
                invalid.add(region.id);
                logger.warn("Region {} has no exposure in any observation and will not be fitted", region.id);
            }
        }
        logger.info("Exposure corrections for {} regions ({} without exposure)", factors.size(), invalid.size());
        return new ExposureCorrectionTable(factors, invalid);
    }

    private static double meanOver(float[][] exposure, List<Pixel> pixels) {
        if (pixels.isEmpty()) return 0;
        double s = 0;
        for (Pixel p : pixels) {
            float v = exposure[p.y][p.x];
            if (Float.isFinite(v) && v > 0) s += v;
        }
        return s / pixels.size();
    }

    private static double peak(float[][] exposure) {
        double max = 0;
        for (float[] row : exposure) {
            for (float v : row) {
                if (Float.isFinite(v) && v > max) max = v;
            }
        }
        return max;
    }
}
