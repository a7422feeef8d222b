package com.clustermap.service;

import com.clustermap.exceptions.PipelineStageException;
import com.clustermap.model.BinningParameters;
import com.clustermap.model.CoordinateReference;
import com.clustermap.model.ExposureCorrectionTable;
import com.clustermap.model.PipelineStage;
import com.clustermap.model.Region;
import com.clustermap.model.RegionIndexMap;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persists the binning output of one resolution: region index map and scale map as FITS
 * images, region catalogue and exposure corrections as CSV. Growth traces and merge events
 * are not persisted.
 */
public class RegionMapStore {

    public static final String INDEX_FILE = "region_index.fits";
    public static final String SCALE_FILE = "scale_map.fits";
    public static final String CATALOGUE_FILE = "regions.csv";
    public static final String CORRECTIONS_FILE = "exposure_corrections.csv";

    private static final String CATALOGUE_HEADER = "region,center_x,center_y,radius,signal_to_noise,pixels,absorbed";

    private final Path dir;
    private final FitsImageService fits;

    public RegionMapStore(Path dir, FitsImageService fits) {
        this.dir = dir;
        this.fits = fits;
    }

    public boolean exists() {
        return Files.isRegularFile(dir.resolve(INDEX_FILE)) && Files.isRegularFile(dir.resolve(CATALOGUE_FILE));
    }

    public void save(RegionIndexMap index, CoordinateReference ref, BinningParameters params) throws IOException {
        Files.createDirectories(dir);
        Map<String, Object> cards = new LinkedHashMap<>();
        cards.put("SNTARGET", params.signalToNoise);
        cards.put("RESOLUT", params.resolution.level());
        cards.put("NREGIONS", index.regionCount());
        cards.put("EXCLUDED", RegionIndexMap.EXCLUDED);
        fits.writeIntImage(index.ids(), ref, dir.resolve(INDEX_FILE).toFile(), cards);
        fits.writeFloatImage(index.scaleMap(), ref, dir.resolve(SCALE_FILE).toFile(), Map.of("BUNIT", "pixel"));

        try (BufferedWriter w = Files.newBufferedWriter(dir.resolve(CATALOGUE_FILE), StandardCharsets.UTF_8)) {
            w.write(CATALOGUE_HEADER);
            w.write('\n');
            for (Region r : index.regions()) {
                w.write(r.id + "," + r.centerX + "," + r.centerY + "," + r.radius + ","
                        + r.signalToNoise + "," + r.pixelCount + "," + r.absorbedPixels);
                w.write('\n');
            }
        }
    }

    /**
     * @throws PipelineStageException when binning has not produced the files yet; fitting cannot start without them
     */
    public RegionIndexMap load() throws PipelineStageException, IOException {
        if (!exists()) {
            throw new PipelineStageException(PipelineStage.FIT_SPECTRA,
                    "region index map missing in " + dir + "; run adaptive binning first");
        }
        int[][] ids = fits.readIntImage(dir.resolve(INDEX_FILE).toFile());

        List<String> lines = Files.readAllLines(dir.resolve(CATALOGUE_FILE), StandardCharsets.UTF_8);
        if (lines.isEmpty() || !CATALOGUE_HEADER.equals(lines.get(0).trim())) {
            throw new IOException("Not a region catalogue: " + dir.resolve(CATALOGUE_FILE));
        }
        List<Region> regions = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) continue;
            String[] c = line.split(",");
            if (c.length != 7) throw new IOException("Malformed region catalogue line " + (i + 1));
            try {
                regions.add(new Region(Integer.parseInt(c[0]), Integer.parseInt(c[1]), Integer.parseInt(c[2]),
                        Double.parseDouble(c[3]), Double.parseDouble(c[4]),
                        Integer.parseInt(c[5]), Integer.parseInt(c[6]), null));
            } catch (NumberFormatException e) {
                throw new IOException("Malformed region catalogue line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        try {
            return new RegionIndexMap(ids, regions, List.of());
        } catch (IllegalArgumentException e) {
            throw new IOException("Region index map and catalogue in " + dir + " disagree: " + e.getMessage(), e);
        }
    }

    /** One line per region; invalid regions carry NaN. */
    public void saveCorrections(ExposureCorrectionTable table) throws IOException {
        Files.createDirectories(dir);
        try (BufferedWriter w = Files.newBufferedWriter(dir.resolve(CORRECTIONS_FILE), StandardCharsets.UTF_8)) {
            w.write("region,factor\n");
            for (Map.Entry<Integer, Double> e : table.factors().entrySet()) {
                w.write(e.getKey() + "," + e.getValue() + "\n");
            }
            for (Integer id : table.invalidRegions()) {
                w.write(id + ",NaN\n");
            }
        }
    }

    public ExposureCorrectionTable loadCorrections() throws PipelineStageException, IOException {
        Path file = dir.resolve(CORRECTIONS_FILE);
        if (!Files.isRegularFile(file)) {
            throw new PipelineStageException(PipelineStage.FIT_SPECTRA,
                    "exposure corrections missing in " + dir + "; run adaptive binning first");
        }
        Map<Integer, Double> factors = new LinkedHashMap<>();
        Set<Integer> invalid = new HashSet<>();
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) continue;
            String[] c = line.split(",");
            try {
                int id = Integer.parseInt(c[0]);
                double f = Double.parseDouble(c[1]);
                if (f > 0) factors.put(id, f); else invalid.add(id);
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                throw new IOException("Malformed exposure correction line " + (i + 1) + " in " + file, e);
            }
        }
        return new ExposureCorrectionTable(factors, invalid);
    }

    public CoordinateReference reference() throws IOException {
        return fits.readReference(dir.resolve(INDEX_FILE).toFile());
    }
}
