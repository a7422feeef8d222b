package com.clustermap.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParameterEstimateTest {

    @Test
    void errorIsHalfTheInterval() {
        ParameterEstimate t = new ParameterEstimate(4.0, 3.0, 5.0);
        assertEquals(1.0, t.error(), 1e-12);
        assertEquals(0.25, t.fractionalError(), 1e-12);
    }

    @Test
    void scalingScalesTheWholeInterval() {
        ParameterEstimate n = ParameterEstimate.symmetric(2.0, 0.5).scaled(0.5);
        assertEquals(1.0, n.value, 1e-12);
        assertEquals(0.75, n.lower, 1e-12);
        assertEquals(1.25, n.upper, 1e-12);
    }

    @Test
    void missingIsNotFinite() {
        assertFalse(ParameterEstimate.MISSING.isFinite());
        assertTrue(Double.isNaN(new ParameterEstimate(0, -1, 1).fractionalError()));
    }

    @Test
    void failedRecordsCarryNoParameters() {
        FitRecord r = FitRecord.failed(3, "insufficient counts");
        assertFalse(r.isConverged());
        assertFalse(r.temperature.isFinite());
        assertTrue(Double.isNaN(r.reducedStatistic()));
    }

    @Test
    void valuesCompareByContentWithMissingParametersEqual() {
        assertEquals(new ParameterEstimate(Double.NaN, Double.NaN, Double.NaN), ParameterEstimate.MISSING);
        assertEquals(FitRecord.failed(3, "timed out"), FitRecord.failed(3, "timed out"));
        assertEquals(FitRecord.failed(3, "timed out").hashCode(), FitRecord.failed(3, "timed out").hashCode());
        assertNotEquals(FitRecord.failed(3, "timed out"), FitRecord.skipped(3, "timed out"));
        assertEquals("", new FitRecord(1, null, null, null, 0, 0, FitRecord.Status.CONVERGED, null).reason);
    }

    @Test
    void recordsRejectInvalidIdsAndMissingStatus() {
        assertThrows(IllegalArgumentException.class, () -> FitRecord.failed(0, "x"));
        assertThrows(IllegalArgumentException.class,
                () -> new FitRecord(1, null, null, null, 0, 0, null, ""));
    }
}
