package com.clustermap.service;

import com.clustermap.model.ExposureCorrectionTable;
import com.clustermap.model.Region;
import com.clustermap.model.RegionIndexMap;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExposureCorrectorTest {

    /** Region 1 is the top row, region 2 the bottom row. */
    private static RegionIndexMap twoRows() {
        int[][] ids = {{1, 1}, {2, 2}};
        return new RegionIndexMap(ids, List.of(
                new Region(1, 0, 0, 1, 12, 2, 0, null),
                new Region(2, 0, 1, 1, 12, 2, 0, null)), List.of());
    }

    @Test
    void factorIsTheShareOfFullDepthExposure() {
        Map<String, float[][]> exposure = new LinkedHashMap<>();
        exposure.put("obs-a", new float[][]{{10f, 10f}, {0f, 0f}});
        exposure.put("obs-b", new float[][]{{10f, 10f}, {10f, 10f}});

        ExposureCorrectionTable table = new ExposureCorrector().correct(twoRows(), exposure);

        assertEquals(1.0, table.factor(1).getAsDouble(), 1e-12);
        assertEquals(0.5, table.factor(2).getAsDouble(), 1e-12);
        assertTrue(table.invalidRegions().isEmpty());
    }

    @Test
    void regionWithoutExposureIsInvalid() {
        ExposureCorrectionTable table = new ExposureCorrector()
                .correct(twoRows(), Map.of("obs-a", new float[][]{{4f, 2f}, {0f, Float.NaN}}));

        assertTrue(table.isValid(1));
        assertEquals(0.75, table.factor(1).getAsDouble(), 1e-12);
        assertFalse(table.isValid(2));
        assertFalse(table.factor(2).isPresent());
        assertEquals(Set.of(2), table.invalidRegions());
    }

    @Test
    void everyValidFactorIsPositive() {
        ExposureCorrectionTable table = new ExposureCorrector()
                .correct(twoRows(), Map.of("obs-a", new float[][]{{0.1f, 0f}, {3f, 3f}}));
        for (double f : table.factors().values()) assertTrue(f > 0);
    }

    @Test
    void rejectsExposureOfTheWrongShape() {
        assertThrows(IllegalArgumentException.class, () -> new ExposureCorrector()
                .correct(twoRows(), Map.of("obs-a", new float[][]{{1f, 1f, 1f}, {1f, 1f, 1f}})));
        assertThrows(IllegalArgumentException.class, () -> new ExposureCorrector().correct(twoRows(), Map.of()));
    }
}
