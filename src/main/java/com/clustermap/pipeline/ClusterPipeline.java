package com.clustermap.pipeline;

import com.clustermap.exceptions.PipelineStageException;
import com.clustermap.model.BinningParameters;
import com.clustermap.model.ClusterInfo;
import com.clustermap.model.CoordinateReference;
import com.clustermap.model.ExposureCorrectionTable;
import com.clustermap.model.FitRecord;
import com.clustermap.model.FitSummary;
import com.clustermap.model.PipelineStage;
import com.clustermap.model.PipelineState;
import com.clustermap.model.PixelGrid;
import com.clustermap.model.RegionIndexMap;
import com.clustermap.model.Resolution;
import com.clustermap.model.SpatialMap;
import com.clustermap.service.ExposureCorrector;
import com.clustermap.service.FitTable;
import com.clustermap.service.FitsImageService;
import com.clustermap.service.MapSynthesizer;
import com.clustermap.service.PipelineListener;
import com.clustermap.service.RegionIndexBuilder;
import com.clustermap.service.RegionMapStore;
import com.clustermap.service.SpectralFitWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs stages 5 to 7 for one cluster directory. Each stage checks that the stage before it
 * has completed, does its work, saves the advanced {@link PipelineState} and returns it.
 * <p>
 * Layout under the cluster directory:
 * <pre>
 *   pipeline.properties
 *   acb/&lt;resolution&gt;/region_index.fits, scale_map.fits, regions.csv, exposure_corrections.csv
 *   acb/&lt;resolution&gt;/spectral_fits.csv
 *   acb/&lt;resolution&gt;/maps/*.fits
 * </pre>
 */
public class ClusterPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ClusterPipeline.class);

    public static final String FIT_TABLE_FILE = "spectral_fits.csv";
    public static final String MAPS_DIR = "maps";

    private final Path clusterDir;
    private final FitsImageService fits;
    private final PipelineListener listener;
    private final PipelineStateStore stateStore;

    public ClusterPipeline(Path clusterDir) {
        this(clusterDir, new FitsImageService(), PipelineListener.NONE);
    }

    public ClusterPipeline(Path clusterDir, FitsImageService fits, PipelineListener listener) {
        this.clusterDir = clusterDir;
        this.fits = fits;
        this.listener = listener != null ? listener : PipelineListener.NONE;
        this.stateStore = new PipelineStateStore(clusterDir);
    }

    public PipelineStateStore stateStore() { return stateStore; }

    public Path binningDir(Resolution resolution) {
        return clusterDir.resolve("acb").resolve(resolution.name().toLowerCase(Locale.ROOT));
    }

    public Path fitTableFile(Resolution resolution) {
        return binningDir(resolution).resolve(FIT_TABLE_FILE);
    }

    public Path mapFile(Resolution resolution, String mapName) {
        return binningDir(resolution).resolve(MAPS_DIR).resolve(mapName + ".fits");
    }

    /** Stage 5: bins the counts image, computes exposure corrections and writes both. */
    public PipelineState createBins(PipelineState state, PixelGrid grid, Map<String, float[][]> observationExposure,
                                    BinningParameters params) throws PipelineStageException, IOException {
        requirePrevious(state, PipelineStage.CREATE_BINS);
        listener.stageStarted(PipelineStage.CREATE_BINS);

        RegionIndexMap index = new RegionIndexBuilder(listener).build(grid, params);
        ExposureCorrectionTable corrections;
        try {
            corrections = new ExposureCorrector().correct(index, observationExposure);
        } catch (IllegalArgumentException e) {
            throw new PipelineStageException(PipelineStage.CREATE_BINS, e.getMessage(), e);
        }

        RegionMapStore store = new RegionMapStore(binningDir(params.resolution), fits);
        store.save(index, grid.reference(), params);
        store.saveCorrections(corrections);

        String summary = String.format("%d regions, %d merges, %d without exposure",
                index.regionCount(), index.merges().size(), corrections.invalidRegions().size());
        logger.info("{}: {}", PipelineStage.CREATE_BINS, summary);
        listener.stageCompleted(PipelineStage.CREATE_BINS, summary);
        return advance(state, PipelineStage.CREATE_BINS);
    }

    /**
     * Stage 6: fits every region of the given resolution. A cancelled run leaves the state
     * where it was; running again resumes from the fit table.
     */
    public PipelineState fitSpectra(PipelineState state, Resolution resolution, ClusterInfo cluster,
                                    SpectralFitWorkerPool pool) throws PipelineStageException, IOException {
        requirePrevious(state, PipelineStage.FIT_SPECTRA);
        listener.stageStarted(PipelineStage.FIT_SPECTRA);

        RegionMapStore store = new RegionMapStore(binningDir(resolution), fits);
        RegionIndexMap index = store.load();
        ExposureCorrectionTable corrections = store.loadCorrections();

        FitSummary summary;
        try (FitTable table = FitTable.open(fitTableFile(resolution))) {
            summary = pool.run(index, corrections, cluster, table);
        }
        listener.stageCompleted(PipelineStage.FIT_SPECTRA, summary.toString());
        if (summary.cancelled) {
            logger.info("{} cancelled after {}; rerun to resume", PipelineStage.FIT_SPECTRA, summary);
            return state;
        }
        return advance(state, PipelineStage.FIT_SPECTRA);
    }

    /**
     * Stage 7: writes the temperature, temperature error and fractional error maps, plus the
     * overlap-averaged temperature map when {@code average} is set.
     */
    public PipelineState makeTemperatureMaps(PipelineState state, Resolution resolution, boolean average)
            throws PipelineStageException, IOException {
        requirePrevious(state, PipelineStage.TEMPERATURE_MAP);
        listener.stageStarted(PipelineStage.TEMPERATURE_MAP);

        RegionMapStore store = new RegionMapStore(binningDir(resolution), fits);
        RegionIndexMap index;
        try {
            index = store.load();
        } catch (PipelineStageException e) {
            throw new PipelineStageException(PipelineStage.TEMPERATURE_MAP, "region index map missing", e);
        }
        Path tableFile = fitTableFile(resolution);
        if (!Files.isRegularFile(tableFile)) {
            throw new PipelineStageException(PipelineStage.TEMPERATURE_MAP, "spectral fits missing: " + tableFile);
        }
        Map<Integer, FitRecord> records = FitTable.load(tableFile);

        MapSynthesizer synthesizer = new MapSynthesizer();
        List<SpatialMap> maps = new ArrayList<>(synthesizer.temperatureProducts(index, records));
        if (average) maps.add(synthesizer.averagedTemperature(index, records));

        CoordinateReference ref = store.reference();
        for (SpatialMap map : maps) {
            fits.writeMap(map, ref, mapFile(resolution, map.name()).toFile());
        }
        listener.stageCompleted(PipelineStage.TEMPERATURE_MAP, maps.size() + " maps written");
        return advance(state, PipelineStage.TEMPERATURE_MAP);
    }

    public SpatialMap makePressureMap(PipelineState state, Resolution resolution, float[][] density, boolean normalize)
            throws PipelineStageException, IOException {
        SpatialMap temperature = readTemperatureMap(state, resolution);
        return writeProduct(resolution, derive(() -> new MapSynthesizer().pressure(temperature, density, normalize)));
    }

    public SpatialMap makeEntropyMap(PipelineState state, Resolution resolution, float[][] density, boolean normalize)
            throws PipelineStageException, IOException {
        SpatialMap temperature = readTemperatureMap(state, resolution);
        return writeProduct(resolution, derive(() -> new MapSynthesizer().entropy(temperature, density, normalize)));
    }

    private SpatialMap readTemperatureMap(PipelineState state, Resolution resolution) throws PipelineStageException, IOException {
        Path file = mapFile(resolution, MapSynthesizer.FitField.TEMPERATURE.mapName());
        if (!state.hasCompleted(PipelineStage.TEMPERATURE_MAP) || !Files.isRegularFile(file)) {
            throw new PipelineStageException(PipelineStage.TEMPERATURE_MAP,
                    "temperature map missing; make the temperature map first");
        }
        return new SpatialMap(MapSynthesizer.FitField.TEMPERATURE.mapName(),
                MapSynthesizer.FitField.TEMPERATURE.unit(), fits.readFloatImage(file.toFile()));
    }

    private SpatialMap derive(Supplier<SpatialMap> product) throws PipelineStageException {
        try {
            return product.get();
        } catch (IllegalArgumentException e) {
            throw new PipelineStageException(PipelineStage.TEMPERATURE_MAP, e.getMessage(), e);
        }
    }

    private SpatialMap writeProduct(Resolution resolution, SpatialMap map) throws IOException {
        CoordinateReference ref = new RegionMapStore(binningDir(resolution), fits).reference();
        fits.writeMap(map, ref, mapFile(resolution, map.name()).toFile());
        return map;
    }

    private static void requirePrevious(PipelineState state, PipelineStage stage) throws PipelineStageException {
        PipelineStage previous = PipelineStage.of(stage.number() - 1);
        if (!state.hasCompleted(previous)) {
            throw new PipelineStageException(stage, previous + " has not completed for " + state.clusterName
                    + " (last completed stage: " + state.lastCompletedStage + ")");
        }
    }

    private PipelineState advance(PipelineState state, PipelineStage stage) throws IOException {
        PipelineState next = state.completed(stage);
        stateStore.save(next);
        return next;
    }
}
