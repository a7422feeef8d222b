package com.clustermap.service;

import com.clustermap.exceptions.PipelineStageException;
import com.clustermap.exceptions.SpectrumExtractionException;
import com.clustermap.model.ClusterInfo;
import com.clustermap.model.ExposureCorrectionTable;
import com.clustermap.model.FitPoolSettings;
import com.clustermap.model.FitRecord;
import com.clustermap.model.FitRequest;
import com.clustermap.model.FitSummary;
import com.clustermap.model.PipelineStage;
import com.clustermap.model.Pixel;
import com.clustermap.model.PlasmaFitResult;
import com.clustermap.model.Region;
import com.clustermap.model.RegionIndexMap;
import com.clustermap.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fits every valid region in parallel and checkpoints each result to a {@link FitTable}.
 * <p>
 * Regions already converged in the table are not fitted again, so an interrupted run is
 * resumed by running again with the same table. Workers only compute; the calling thread
 * is the single writer of the table. At most {@code workers} regions are in flight, which
 * lets {@link #cancel()} stop dispatch while the running fits finish and are recorded.
 * <p>
 * A fit running past the timeout is cancelled and recorded as failed, and its slot is given
 * to the next region on a fresh thread. An optimizer that ignores interruption may keep its
 * abandoned daemon thread busy, but never delays or fails the regions after it.
 */
public class SpectralFitWorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(SpectralFitWorkerPool.class);

    private final SpectrumExtractor extractor;
    private final PlasmaModelFitter fitter;
    private final FitPoolSettings settings;
    private final PipelineListener listener;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public SpectralFitWorkerPool(SpectrumExtractor extractor, PlasmaModelFitter fitter, FitPoolSettings settings) {
        this(extractor, fitter, settings, PipelineListener.NONE);
    }

    public SpectralFitWorkerPool(SpectrumExtractor extractor, PlasmaModelFitter fitter, FitPoolSettings settings,
                                 PipelineListener listener) {
        if (extractor == null || fitter == null || settings == null) {
            throw new IllegalArgumentException("Extractor, fitter and settings are required");
        }
        this.extractor = extractor;
        this.fitter = fitter;
        this.settings = settings;
        this.listener = listener != null ? listener : PipelineListener.NONE;
    }

    /** Stops submitting regions. Fits already running complete and are written. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public FitSummary run(RegionIndexMap index, ExposureCorrectionTable corrections, ClusterInfo cluster, FitTable table)
            throws PipelineStageException, IOException {
        if (index == null || corrections == null || cluster == null || table == null) {
            throw new IllegalArgumentException("Region index map, corrections, cluster and fit table are required");
        }

        int resumed = 0, skipped = 0;
        List<Integer> pending = new ArrayList<>();
        for (Region region : index.regions()) {
            int id = region.id;
            if (table.isConverged(id)) {
                resumed++;
            } else if (!corrections.isValid(id)) {
                skipped++;
                boolean recorded = table.record(id).map(r -> r.status == FitRecord.Status.SKIPPED).orElse(false);
                if (!recorded) {
                    FitRecord rec = FitRecord.skipped(id, "no exposure");
                    table.append(rec);
                    listener.regionFitted(rec, 0, 0);
                }
            } else {
                pending.add(id);
            }
        }
        logger.info("Fitting {} regions with {} workers ({} already converged, {} without exposure)",
                pending.size(), settings.workers, resumed, skipped);

        int[] outcome = dispatch(pending, index, corrections, cluster, table);
        FitSummary summary = new FitSummary(outcome[0], outcome[1], skipped, resumed, cancelled.get());
        logger.info("Spectral fitting finished: {}", summary);

        if (summary.totalConverged() == 0) {
            throw new PipelineStageException(PipelineStage.FIT_SPECTRA, "no region converged (" + summary + ")");
        }
        return summary;
    }

    /** Returns {converged, failed} for this run. */
    private int[] dispatch(List<Integer> pending, RegionIndexMap index, ExposureCorrectionTable corrections,
                           ClusterInfo cluster, FitTable table) throws IOException {
        int converged = 0, failed = 0, written = 0;
        boolean interrupted = false;
        long timeoutNanos = settings.fitTimeout.toNanos();

        // one thread per job: an abandoned fit that ignores interruption keeps only its own thread
        ExecutorService exec = Executors.newCachedThreadPool(workerThreads());
        CompletionService<FitRecord> completion = new ExecutorCompletionService<>(exec);
        Map<Future<FitRecord>, InFlight> inFlight = new HashMap<>();
        Iterator<Integer> queue = pending.iterator();
        try {
            while (true) {
                while (inFlight.size() < settings.workers && queue.hasNext() && !cancelled.get()) {
                    int id = queue.next();
                    InFlight job = new InFlight(id);
                    Future<FitRecord> f = completion.submit(() -> {
                        job.markStarted();
                        return fitRegion(id, index, corrections, cluster);
                    });
                    inFlight.put(f, job);
                }
                if (inFlight.isEmpty()) break;

                long now = System.nanoTime();
                long wait = timeoutNanos;
                for (InFlight job : inFlight.values()) {
                    if (job.hasStarted()) wait = Math.min(wait, job.started + timeoutNanos - now);
                }

                Future<FitRecord> done;
                try {
                    done = completion.poll(Math.max(wait, 1), TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    logger.warn("Interrupted; no further regions will be submitted, waiting for {} running fits", inFlight.size());
                    interrupted = true;
                    cancelled.set(true);
                    continue;
                }

                List<FitRecord> results = new ArrayList<>();
                if (done != null) {
                    InFlight job = inFlight.remove(done);
                    if (job != null) results.add(outcomeOf(done, job.regionId));
                } else {
                    now = System.nanoTime();
                    Iterator<Map.Entry<Future<FitRecord>, InFlight>> it = inFlight.entrySet().iterator();
                    while (it.hasNext()) {
                        Map.Entry<Future<FitRecord>, InFlight> e = it.next();
                        InFlight job = e.getValue();
                        if (!job.hasStarted() || now - job.started < timeoutNanos) continue;
                        e.getKey().cancel(true);
                        it.remove();
                        logger.warn("Region {} exceeded the {} fit timeout and was abandoned",
                                job.regionId, settings.fitTimeout);
                        results.add(FitRecord.failed(job.regionId, "timed out after " + settings.fitTimeout));
                    }
                }

                for (FitRecord rec : results) {
                    table.append(rec);
                    written++;
                    if (rec.isConverged()) converged++; else failed++;
                    listener.regionFitted(rec, written, pending.size());
                }
            }
        } finally {
            exec.shutdownNow();
            if (interrupted) Thread.currentThread().interrupt();
        }
        return new int[]{converged, failed};
    }

    private FitRecord outcomeOf(Future<FitRecord> done, int regionId) {
        try {
            return done.get();
        } catch (CancellationException e) {
            return FitRecord.failed(regionId, "cancelled");
        } catch (ExecutionException e) {
            logger.error("Fit worker for region {} died", regionId, e.getCause());
            return FitRecord.failed(regionId, "worker error: " + e.getCause());
        } catch (InterruptedException e) {
            // the future is already done, get() does not block
            Thread.currentThread().interrupt();
            return FitRecord.failed(regionId, "interrupted");
        }
    }

    FitRecord fitRegion(int regionId, RegionIndexMap index, ExposureCorrectionTable corrections, ClusterInfo cluster) {
        List<Pixel> pixels = index.pixelsOf(regionId);
        List<Spectrum> spectra = new ArrayList<>();
        for (String obsId : cluster.observationIds) {
            try {
                spectra.add(extractor.extract(regionId, pixels, obsId));
            } catch (SpectrumExtractionException e) {
                logger.warn("Region {}: spectrum extraction failed for observation {}: {}", regionId, obsId, e.getMessage());
                return FitRecord.failed(regionId, "extraction failed for " + obsId + ": " + e.getMessage());
            }
        }

        FitRequest request = new FitRequest(regionId, spectra, settings.startTemperature, cluster.abundance,
                cluster.redshift, cluster.hydrogenColumnDensity);
        double net = request.netCounts();
        if (net <= 0 || net < settings.minimumNetCounts) {
            logger.warn("Region {} has {} net counts; not fitted", regionId, net);
            return FitRecord.failed(regionId, String.format("insufficient counts (%.1f net)", net));
        }

        PlasmaFitResult result;
        try {
            result = fitter.fit(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FitRecord.failed(regionId, "interrupted");
        } catch (Exception e) {
            logger.warn("Region {}: optimizer error", regionId, e);
            return FitRecord.failed(regionId, "optimizer error: " + e.getMessage());
        }
        if (result == null || !result.converged) {
            logger.debug("Region {} did not converge", regionId);
            return FitRecord.failed(regionId, "fit did not converge");
        }

        double factor = corrections.factor(regionId).orElse(1.0);
        return new FitRecord(regionId,
                result.temperature,
                result.abundance,
                result.normalization.scaled(1.0 / factor),
                result.dof,
                result.statistic,
                FitRecord.Status.CONVERGED,
                "");
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("spectral-fit-" + n.incrementAndGet());
            return t;
        };
    }

    /** A submitted region. Its timeout clock starts when a worker picks it up, not at submission. */
    private static class InFlight {
        final int regionId;
        volatile long started;
        volatile boolean running;

        InFlight(int regionId) {
            this.regionId = regionId;
        }

        void markStarted() {
            started = System.nanoTime();
            running = true;
        }

        boolean hasStarted() {
            return running;
        }
    }
}
