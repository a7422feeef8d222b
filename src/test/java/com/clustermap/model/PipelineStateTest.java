package com.clustermap.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineStateTest {

    @Test
    void completingAStageAdvancesTheCounter() {
        PipelineState s = new PipelineState("A1795", 4).completed(PipelineStage.CREATE_BINS);

        assertEquals(5, s.lastCompletedStage);
        assertTrue(s.hasCompleted(PipelineStage.CROP_DATA));
        assertTrue(s.hasCompleted(PipelineStage.CREATE_BINS));
        assertFalse(s.hasCompleted(PipelineStage.FIT_SPECTRA));
    }

    @Test
    void rerunningAnEarlierStageNeverMovesBackwards() {
        PipelineState s = new PipelineState("A1795", 7).completed(PipelineStage.CREATE_BINS);
        assertEquals(7, s.lastCompletedStage);
    }

    @Test
    void rejectsInvalidStates() {
        assertThrows(IllegalArgumentException.class, () -> new PipelineState("", 1));
        assertThrows(IllegalArgumentException.class, () -> new PipelineState("A1795", 8));
        assertThrows(IllegalArgumentException.class, () -> new PipelineState("A1795", -1));
    }

    @Test
    void stagesAreNumberedOneToSeven() {
        assertEquals(PipelineStage.FIT_SPECTRA, PipelineStage.of(6));
        assertEquals("Stage 7 (temperature map)", PipelineStage.TEMPERATURE_MAP.toString());
        assertThrows(IllegalArgumentException.class, () -> PipelineStage.of(0));
    }
}
