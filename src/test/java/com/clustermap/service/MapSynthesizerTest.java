package com.clustermap.service;

import com.clustermap.model.FitRecord;
import com.clustermap.model.ParameterEstimate;
import com.clustermap.model.Region;
import com.clustermap.model.RegionIndexMap;
import com.clustermap.model.SpatialMap;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MapSynthesizerTest {

    private final MapSynthesizer synthesizer = new MapSynthesizer();

    private static FitRecord converged(int id, double t, double err) {
        return new FitRecord(id, ParameterEstimate.symmetric(t, err), ParameterEstimate.symmetric(0.3, 0.05),
                ParameterEstimate.symmetric(1e-3, 1e-4), 50, 48.0, FitRecord.Status.CONVERGED, "");
    }

    /** Region 1 top left, region 2 top right, bottom left excluded, region 3 bottom right. */
    private static RegionIndexMap square() {
        int[][] ids = {{1, 2}, {RegionIndexMap.EXCLUDED, 3}};
        return new RegionIndexMap(ids, List.of(
                new Region(1, 0, 0, 0, 20, 1, 0, null),
                new Region(2, 1, 0, 0, 20, 1, 0, null),
                new Region(3, 1, 1, 0, 20, 1, 0, null)), List.of());
    }

    @Test
    void broadcastPaintsConvergedRegionsOnly() {
        Map<Integer, FitRecord> records = Map.of(
                1, converged(1, 4.0, 0.5),
                2, FitRecord.failed(2, "fit did not converge"));

        SpatialMap t = synthesizer.broadcast(square(), records, MapSynthesizer.FitField.TEMPERATURE);

        assertEquals("temperature", t.name());
        assertEquals("keV", t.unit());
        assertEquals(4.0f, t.valueAt(0, 0));
        assertFalse(t.hasData(1, 0));
        assertFalse(t.hasData(0, 1));
        assertFalse(t.hasData(1, 1));
    }

    @Test
    void abundanceAndNormalizationComeFromTheSameRecords() {
        Map<Integer, FitRecord> records = Map.of(3, converged(3, 6.0, 1.0));

        SpatialMap z = synthesizer.broadcast(square(), records, MapSynthesizer.FitField.ABUNDANCE);
        SpatialMap norm = synthesizer.broadcast(square(), records, MapSynthesizer.FitField.NORMALIZATION);

        assertEquals("abundance", z.name());
        assertEquals(0.3f, z.valueAt(1, 1), 1e-6);
        assertEquals(1e-3f, norm.valueAt(1, 1), 1e-9);
        assertFalse(norm.hasData(0, 0));
    }

    @Test
    void errorMapsFollowTheConfidenceInterval() {
        Map<Integer, FitRecord> records = Map.of(1, converged(1, 4.0, 0.5), 3, converged(3, 8.0, 2.0));

        List<SpatialMap> maps = synthesizer.temperatureProducts(square(), records);

        assertEquals(3, maps.size());
        assertEquals("temperature_error", maps.get(1).name());
        assertEquals(0.5f, maps.get(1).valueAt(0, 0), 1e-6);
        assertEquals(2.0f, maps.get(1).valueAt(1, 1), 1e-6);
        assertEquals("temperature_fractional_error", maps.get(2).name());
        assertEquals(0.125f, maps.get(2).valueAt(0, 0), 1e-6);
        assertEquals(0.25f, maps.get(2).valueAt(1, 1), 1e-6);
    }

    @Test
    void averagedTemperatureBlendsOverlappingCircles() {
        int[][] ids = {{1, 1, 2}};
        RegionIndexMap index = new RegionIndexMap(ids, List.of(
                new Region(1, 0, 0, 1, 20, 2, 0, null),
                new Region(2, 2, 0, 1, 20, 1, 0, null)), List.of());
        Map<Integer, FitRecord> records = Map.of(1, converged(1, 2.0, 0.1), 2, converged(2, 4.0, 0.1));

        SpatialMap avg = synthesizer.averagedTemperature(index, records);

        assertEquals("temperature_average", avg.name());
        assertEquals(2.0f, avg.valueAt(0, 0), 1e-6);
        assertEquals(3.0f, avg.valueAt(1, 0), 1e-6);
        assertEquals(4.0f, avg.valueAt(2, 0), 1e-6);
    }

    @Test
    void pressureAndEntropyCombineTemperatureWithDensity() {
        SpatialMap t = new SpatialMap("temperature", "keV", new float[][]{{2f, SpatialMap.NO_DATA, 2f}});
        float[][] density = {{8f, 1f, 0f}};

        SpatialMap p = synthesizer.pressure(t, density, false);
        assertEquals(16f, p.valueAt(0, 0), 1e-6);
        assertFalse(p.hasData(1, 0));
        assertEquals(0f, p.valueAt(2, 0));

        SpatialMap k = synthesizer.entropy(t, density, false);
        assertEquals(0.5f, k.valueAt(0, 0), 1e-6);
        assertFalse(k.hasData(1, 0));
        assertFalse(k.hasData(2, 0));
    }

    @Test
    void normalizedProductsPeakAtOne() {
        SpatialMap t = new SpatialMap("temperature", "keV", new float[][]{{2f, 4f}});

        SpatialMap p = synthesizer.pressure(t, new float[][]{{1f, 2f}}, true);

        assertEquals("normalized", p.unit());
        assertEquals(0.25f, p.valueAt(0, 0), 1e-6);
        assertEquals(1f, p.valueAt(1, 0), 1e-6);
        assertTrue(p.statistics().max <= 1.0 + 1e-6);
    }

    @Test
    void densityMustMatchTheTemperatureMap() {
        SpatialMap t = new SpatialMap("temperature", "keV", new float[][]{{2f, 4f}});
        assertThrows(IllegalArgumentException.class, () -> synthesizer.pressure(t, new float[][]{{1f}}, false));
        assertThrows(IllegalArgumentException.class, () -> synthesizer.entropy(t, new float[2][2], false));
    }
}
