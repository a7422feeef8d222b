package com.clustermap.service;

import com.clustermap.exceptions.PipelineStageException;
import com.clustermap.exceptions.SpectrumExtractionException;
import com.clustermap.model.ClusterInfo;
import com.clustermap.model.ExposureCorrectionTable;
import com.clustermap.model.FitPoolSettings;
import com.clustermap.model.FitRecord;
import com.clustermap.model.FitRequest;
import com.clustermap.model.FitSummary;
import com.clustermap.model.ParameterEstimate;
import com.clustermap.model.PipelineStage;
import com.clustermap.model.Pixel;
import com.clustermap.model.PlasmaFitResult;
import com.clustermap.model.Region;
import com.clustermap.model.RegionIndexMap;
import com.clustermap.model.Spectrum;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(30)
class SpectralFitWorkerPoolTest {

    private static final int REGIONS = 6;
    private static final ClusterInfo CLUSTER = new ClusterInfo("A2029", List.of("891", "4977"), 0.077, 0.0325, 0.3);

    @TempDir
    Path dir;

    /** One pixel per region, in a single row. */
    private static RegionIndexMap row() {
        int[][] ids = new int[1][REGIONS];
        List<Region> regions = new ArrayList<>();
        for (int i = 0; i < REGIONS; i++) {
            ids[0][i] = i + 1;
            regions.add(new Region(i + 1, i, 0, 0, 10, 1, 0, null));
        }
        return new RegionIndexMap(ids, regions, List.of());
    }

    private static ExposureCorrectionTable corrections(Set<Integer> invalid) {
        Map<Integer, Double> factors = new HashMap<>();
        for (int id = 1; id <= REGIONS; id++) {
            if (!invalid.contains(id)) factors.put(id, 0.5);
        }
        return new ExposureCorrectionTable(factors, invalid);
    }

    /** Region {@code id} yields {@code 10 * id} counts per observation, or none when listed as empty. */
    private static class FakeExtractor implements SpectrumExtractor {
        final Set<Integer> empty;
        final Set<Integer> broken;

        FakeExtractor(Set<Integer> empty, Set<Integer> broken) {
            this.empty = empty;
            this.broken = broken;
        }

        @Override
        public Spectrum extract(int regionId, List<Pixel> pixels, String observationId)
                throws SpectrumExtractionException {
            if (broken.contains(regionId)) throw new SpectrumExtractionException("no events file for " + observationId);
            double counts = empty.contains(regionId) ? 0 : 10.0 * regionId;
            return new Spectrum(regionId, observationId, new double[]{counts}, null, 1000);
        }
    }

    /** Temperature equals the region id; counts calls per region. */
    private static class FakeFitter implements PlasmaModelFitter {
        final Map<Integer, AtomicInteger> calls = new ConcurrentHashMap<>();
        final Set<Integer> diverging = ConcurrentHashMap.newKeySet();
        final Set<Integer> hanging = ConcurrentHashMap.newKeySet();
        /** Spin without checking the interrupt flag until released. */
        final Set<Integer> stubborn = ConcurrentHashMap.newKeySet();
        final AtomicBoolean released = new AtomicBoolean();

        @Override
        public PlasmaFitResult fit(FitRequest request) throws Exception {
            int id = request.regionId;
            calls.computeIfAbsent(id, k -> new AtomicInteger()).incrementAndGet();
            if (hanging.contains(id)) Thread.sleep(60_000);
            while (stubborn.contains(id) && !released.get()) Thread.onSpinWait();
            if (diverging.contains(id)) return PlasmaFitResult.notConverged(10, 1e3);
            return new PlasmaFitResult(
                    new ParameterEstimate(id, id - 0.5, id + 0.5),
                    ParameterEstimate.symmetric(request.startAbundance, 0.1),
                    ParameterEstimate.symmetric(1.0, 0.2),
                    request.spectra.size() * 10, 12.5, true);
        }

        int calls(int id) {
            AtomicInteger n = calls.get(id);
            return n == null ? 0 : n.get();
        }
    }

    @Test
    void fitsEveryRegionAndAppliesTheExposureCorrection() throws Exception {
        FakeFitter fitter = new FakeFitter();
        SpectralFitWorkerPool pool = new SpectralFitWorkerPool(new FakeExtractor(Set.of(), Set.of()), fitter,
                FitPoolSettings.withWorkers(3));

        try (FitTable table = FitTable.open(dir.resolve("fits.csv"))) {
            FitSummary summary = pool.run(row(), corrections(Set.of()), CLUSTER, table);

            assertEquals(REGIONS, summary.converged);
            assertEquals(0, summary.failed);
            assertFalse(summary.cancelled);
            FitRecord r = table.record(4).orElseThrow();
            assertEquals(4.0, r.temperature.value);
            assertEquals(2.0, r.normalization.value, 1e-12);
            assertEquals(20, r.dof);
        }
    }

    @Test
    void interruptedRunResumesToTheSameResultWithoutRefitting() throws Exception {
        FakeFitter fitter = new FakeFitter();
        Path file = dir.resolve("fits.csv");

        SpectralFitWorkerPool[] first = new SpectralFitWorkerPool[1];
        PipelineListener stopAfterTwo = new PipelineListener() {
            @Override
            public void regionFitted(FitRecord record, int completed, int total) {
                if (completed == 2) first[0].cancel();
            }
        };
        first[0] = new SpectralFitWorkerPool(new FakeExtractor(Set.of(), Set.of()), fitter,
                FitPoolSettings.withWorkers(1), stopAfterTwo);
        try (FitTable table = FitTable.open(file)) {
            FitSummary summary = first[0].run(row(), corrections(Set.of()), CLUSTER, table);
            assertTrue(summary.cancelled);
            assertEquals(2, summary.converged);
        }

        SpectralFitWorkerPool second = new SpectralFitWorkerPool(new FakeExtractor(Set.of(), Set.of()), fitter,
                FitPoolSettings.withWorkers(2));
        Map<Integer, FitRecord> resumed;
        try (FitTable table = FitTable.open(file)) {
            FitSummary summary = second.run(row(), corrections(Set.of()), CLUSTER, table);
            assertEquals(2, summary.resumed);
            assertEquals(REGIONS - 2, summary.converged);
        }
        try (FitTable table = FitTable.open(file)) {
            resumed = table.records();
        }
        for (int id = 1; id <= REGIONS; id++) {
            assertEquals(1, fitter.calls(id), "fits of region " + id);
        }

        Path reference = dir.resolve("uninterrupted.csv");
        try (FitTable table = FitTable.open(reference)) {
            new SpectralFitWorkerPool(new FakeExtractor(Set.of(), Set.of()), new FakeFitter(),
                    FitPoolSettings.withWorkers(4)).run(row(), corrections(Set.of()), CLUSTER, table);
        }
        try (FitTable table = FitTable.open(reference)) {
            assertEquals(table.records(), resumed);
        }
    }

    @Test
    void regionWithoutNetCountsFailsOnceWhileOthersConverge() throws Exception {
        FakeFitter fitter = new FakeFitter();
        SpectralFitWorkerPool pool = new SpectralFitWorkerPool(new FakeExtractor(Set.of(3), Set.of()), fitter,
                FitPoolSettings.withWorkers(2));

        try (FitTable table = FitTable.open(dir.resolve("fits.csv"))) {
            FitSummary summary = pool.run(row(), corrections(Set.of()), CLUSTER, table);

            assertEquals(1, summary.failed);
            assertEquals(REGIONS - 1, summary.converged);
            assertEquals(FitRecord.Status.FAILED, table.record(3).orElseThrow().status);
            assertEquals(1, table.history().stream().filter(r -> r.regionId == 3).count());
            assertEquals(0, fitter.calls(3));
        }
    }

    @Test
    void extractionFailureIsRecordedAsFailed() throws Exception {
        SpectralFitWorkerPool pool = new SpectralFitWorkerPool(new FakeExtractor(Set.of(), Set.of(5)), new FakeFitter(),
                FitPoolSettings.withWorkers(2));

        try (FitTable table = FitTable.open(dir.resolve("fits.csv"))) {
            pool.run(row(), corrections(Set.of()), CLUSTER, table);
            FitRecord r = table.record(5).orElseThrow();
            assertEquals(FitRecord.Status.FAILED, r.status);
            assertTrue(r.reason.startsWith("extraction failed"));
        }
    }

    @Test
    void overdueFitIsAbandonedAndRecordedAsFailed() throws Exception {
        FakeFitter fitter = new FakeFitter();
        fitter.hanging.add(2);
        SpectralFitWorkerPool pool = new SpectralFitWorkerPool(new FakeExtractor(Set.of(), Set.of()), fitter,
                FitPoolSettings.withWorkers(2).withFitTimeout(Duration.ofMillis(300)));

        try (FitTable table = FitTable.open(dir.resolve("fits.csv"))) {
            FitSummary summary = pool.run(row(), corrections(Set.of()), CLUSTER, table);

            assertEquals(1, summary.failed);
            FitRecord r = table.record(2).orElseThrow();
            assertEquals(FitRecord.Status.FAILED, r.status);
            assertTrue(r.reason.startsWith("timed out"));
            assertTrue(table.isConverged(1));
            assertTrue(table.isConverged(REGIONS));
        }
    }

    @Test
    void fitIgnoringInterruptionDoesNotStarveLaterRegions() throws Exception {
        FakeFitter fitter = new FakeFitter();
        fitter.stubborn.add(1);
        SpectralFitWorkerPool pool = new SpectralFitWorkerPool(new FakeExtractor(Set.of(), Set.of()), fitter,
                FitPoolSettings.withWorkers(1).withFitTimeout(Duration.ofMillis(300)));

        try (FitTable table = FitTable.open(dir.resolve("fits.csv"))) {
            FitSummary summary = pool.run(row(), corrections(Set.of()), CLUSTER, table);

            assertEquals(1, summary.failed);
            assertEquals(REGIONS - 1, summary.converged);
            assertTrue(table.record(1).orElseThrow().reason.startsWith("timed out"));
            for (int id = 2; id <= REGIONS; id++) {
                assertTrue(table.isConverged(id), "region " + id);
                assertEquals(1, fitter.calls(id));
            }
        } finally {
            fitter.released.set(true);
        }
    }

    @Test
    void regionsWithoutExposureAreRecordedOnceAcrossRuns() throws Exception {
        FakeFitter fitter = new FakeFitter();
        Path file = dir.resolve("fits.csv");
        for (int run = 0; run < 2; run++) {
            SpectralFitWorkerPool pool = new SpectralFitWorkerPool(new FakeExtractor(Set.of(), Set.of()), fitter,
                    FitPoolSettings.withWorkers(2));
            try (FitTable table = FitTable.open(file)) {
                FitSummary summary = pool.run(row(), corrections(Set.of(4)), CLUSTER, table);
                assertEquals(1, summary.skipped);
            }
        }
        try (FitTable table = FitTable.open(file)) {
            assertEquals(1, table.history().stream().filter(r -> r.regionId == 4).count());
            assertEquals(FitRecord.Status.SKIPPED, table.record(4).orElseThrow().status);
            assertEquals(REGIONS, table.history().size());
        }
        assertEquals(0, fitter.calls(4));
    }

    @Test
    void failedRegionsAreRetriedOnTheNextRun() throws Exception {
        FakeFitter fitter = new FakeFitter();
        fitter.diverging.add(2);
        Path file = dir.resolve("fits.csv");
        try (FitTable table = FitTable.open(file)) {
            new SpectralFitWorkerPool(new FakeExtractor(Set.of(), Set.of()), fitter, FitPoolSettings.withWorkers(2))
                    .run(row(), corrections(Set.of()), CLUSTER, table);
            assertFalse(table.isConverged(2));
        }

        fitter.diverging.clear();
        try (FitTable table = FitTable.open(file)) {
            FitSummary summary = new SpectralFitWorkerPool(new FakeExtractor(Set.of(), Set.of()), fitter,
                    FitPoolSettings.withWorkers(2)).run(row(), corrections(Set.of()), CLUSTER, table);
            assertEquals(1, summary.converged);
            assertEquals(REGIONS - 1, summary.resumed);
            assertTrue(table.isConverged(2));
        }
        assertEquals(2, fitter.calls(2));
        assertEquals(1, fitter.calls(1));
    }

    @Test
    void failsWhenNoRegionConverges() throws Exception {
        FakeFitter fitter = new FakeFitter();
        for (int id = 1; id <= REGIONS; id++) fitter.diverging.add(id);
        SpectralFitWorkerPool pool = new SpectralFitWorkerPool(new FakeExtractor(Set.of(), Set.of()), fitter,
                FitPoolSettings.withWorkers(3));

        try (FitTable table = FitTable.open(dir.resolve("fits.csv"))) {
            PipelineStageException e = assertThrows(PipelineStageException.class,
                    () -> pool.run(row(), corrections(Set.of()), CLUSTER, table));
            assertEquals(PipelineStage.FIT_SPECTRA, e.getStage());
            Set<FitRecord.Status> statuses = new HashSet<>();
            table.records().values().forEach(r -> statuses.add(r.status));
            assertEquals(Set.of(FitRecord.Status.FAILED), statuses);
            assertEquals(REGIONS, table.records().size());
        }
    }
}
