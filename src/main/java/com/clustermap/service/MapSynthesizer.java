package com.clustermap.service;

import com.clustermap.model.FitRecord;
import com.clustermap.model.Region;
import com.clustermap.model.RegionIndexMap;
import com.clustermap.model.SpatialMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Paints region-level fit results back onto the pixel grid and derives the pressure and
 * entropy maps. Every map has the shape of the region index map; pixels that are excluded,
 * or whose region has no converged fit, hold {@link SpatialMap#NO_DATA}.
 */
public class MapSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(MapSynthesizer.class);

    public enum FitField {
        TEMPERATURE("temperature", "keV", r -> r.temperature.value),
        TEMPERATURE_ERROR("temperature_error", "keV", r -> r.temperature.error()),
        TEMPERATURE_FRACTIONAL_ERROR("temperature_fractional_error", "", r -> r.temperature.fractionalError()),
        ABUNDANCE("abundance", "solar", r -> r.abundance.value),
        NORMALIZATION("normalization", "", r -> r.normalization.value);

        private final String mapName;
        private final String unit;
        private final ToDoubleFunction<FitRecord> value;

        FitField(String mapName, String unit, ToDoubleFunction<FitRecord> value) {
            this.mapName = mapName;
            this.unit = unit;
            this.value = value;
        }

        public String mapName() { return mapName; }
        public String unit() { return unit; }
    }

    public SpatialMap broadcast(RegionIndexMap index, Map<Integer, FitRecord> records, FitField field) {
        int w = index.width(), h = index.height();
        float[][] out = new float[h][w];
        int painted = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int id = index.regionAt(x, y);
                FitRecord r = id == RegionIndexMap.EXCLUDED ? null : records.get(id);
                if (r == null || !r.isConverged()) {
                    out[y][x] = SpatialMap.NO_DATA;
                } else {
                    out[y][x] = (float) field.value.applyAsDouble(r);
                    painted++;
                }
            }
        }
        logger.debug("Painted {} map on {} of {} pixels", field.mapName(), painted, w * h);
        return new SpatialMap(field.mapName(), field.unit(), out);
    }

    /**
     * Temperature averaged over every converged region whose circle covers the pixel, so
     * neighbouring bins blend where their circles overlap. Pixels no circle covers keep
     * their owner's temperature.
     */
    public SpatialMap averagedTemperature(RegionIndexMap index, Map<Integer, FitRecord> records) {
        int w = index.width(), h = index.height();
        double[][] sum = new double[h][w];
        int[][] n = new int[h][w];

        for (Region region : index.regions()) {
            FitRecord r = records.get(region.id);
            if (r == null || !r.isConverged()) continue;
            double t = r.temperature.value;
            int rad = (int) Math.ceil(region.radius);
            for (int y = Math.max(0, region.centerY - rad); y <= Math.min(h - 1, region.centerY + rad); y++) {
                for (int x = Math.max(0, region.centerX - rad); x <= Math.min(w - 1, region.centerX + rad); x++) {
                    if (!region.covers(x, y) || index.isExcluded(x, y)) continue;
                    sum[y][x] += t;
                    n[y][x]++;
                }
            }
        }

        float[][] out = new float[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int id = index.regionAt(x, y);
                if (id == RegionIndexMap.EXCLUDED) {
                    out[y][x] = SpatialMap.NO_DATA;
                } else if (n[y][x] > 0) {
                    out[y][x] = (float) (sum[y][x] / n[y][x]);
                } else {
                    FitRecord r = records.get(id);
                    out[y][x] = r != null && r.isConverged() ? (float) r.temperature.value : SpatialMap.NO_DATA;
                }
            }
        }
        return new SpatialMap("temperature_average", "keV", out);
    }

    /** Pressure P = n T. */
    public SpatialMap pressure(SpatialMap temperature, float[][] density, boolean normalize) {
        return combine("pressure", temperature, density, normalize, (t, n) -> n * t);
    }

    /** Entropy K = T n^(-2/3); undefined where the density is not positive. */
    public SpatialMap entropy(SpatialMap temperature, float[][] density, boolean normalize) {
        return combine("entropy", temperature, density, normalize,
                (t, n) -> n > 0 ? t * Math.pow(n, -2.0 / 3.0) : Double.NaN);
    }

    private SpatialMap combine(String name, SpatialMap temperature, float[][] density, boolean normalize, Combiner op) {
        int w = temperature.width(), h = temperature.height();
        if (density == null || density.length != h) {
            throw new IllegalArgumentException("Density map does not match the " + w + "x" + h + " temperature map");
        }
        for (float[] row : density) {
            if (row.length != w) throw new IllegalArgumentException("Density map does not match the " + w + "x" + h + " temperature map");
        }

        float[][] out = new float[h][w];
        double peak = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                float t = temperature.valueAt(x, y);
                float n = density[y][x];
                double v = Float.isFinite(t) && Float.isFinite(n) ? op.apply(t, n) : Double.NaN;
                out[y][x] = Double.isFinite(v) ? (float) v : SpatialMap.NO_DATA;
                if (Double.isFinite(v)) peak = Math.max(peak, Math.abs(v));
            }
        }
        if (normalize && peak > 0) {
            for (float[] row : out) {
                for (int x = 0; x < row.length; x++) row[x] = (float) (row[x] / peak);
            }
        }
        return new SpatialMap(name, normalize ? "normalized" : "", out);
    }

    /** Temperature, its error and fractional error maps, in that order. */
    public List<SpatialMap> temperatureProducts(RegionIndexMap index, Map<Integer, FitRecord> records) {
        return List.of(
                broadcast(index, records, FitField.TEMPERATURE),
                broadcast(index, records, FitField.TEMPERATURE_ERROR),
                broadcast(index, records, FitField.TEMPERATURE_FRACTIONAL_ERROR));
    }

    @FunctionalInterface
    private interface Combiner {
        double apply(double temperature, double density);
    }
}
