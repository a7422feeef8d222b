package com.clustermap.service;

import com.clustermap.exceptions.SpectrumExtractionException;
import com.clustermap.model.PipelineConfig;
import com.clustermap.model.Pixel;
import com.clustermap.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external extraction wrapper around the calibration toolchain once per region
 * and observation:
 * <pre>
 *   tool OBSID PIXEL_FILE OUTPUT_FILE
 * </pre>
 * The pixel file lists one {@code x y} pair per line (0-based image pixels). The tool
 * writes an {@code EXPOSURE=seconds} line followed by {@code channel counts [background]}
 * lines; {@code #} starts a comment. Scratch files are removed once read.
 */
public class CommandLineSpectrumExtractor implements SpectrumExtractor {

    private static final Logger logger = LoggerFactory.getLogger(CommandLineSpectrumExtractor.class);

    private final String toolPath;
    private final Path workDir;
    private final Duration timeout;

    public CommandLineSpectrumExtractor(String toolPath, Path workDir, Duration timeout) {
        this.toolPath = toolPath;
        this.workDir = workDir;
        this.timeout = timeout;
    }

    public static CommandLineSpectrumExtractor fromConfig(Path workDir) {
        return new CommandLineSpectrumExtractor(PipelineConfig.getExtractToolPath(), workDir,
                Duration.ofSeconds(PipelineConfig.getExtractTimeoutSeconds()));
    }

    @Override
    public Spectrum extract(int regionId, List<Pixel> pixels, String observationId) throws SpectrumExtractionException {
        if (toolPath == null || toolPath.isEmpty()) {
            throw new SpectrumExtractionException("Extraction tool path is not configured");
        }
        if (!Files.isExecutable(Paths.get(toolPath))) {
            throw new SpectrumExtractionException("Extraction tool is not executable: " + toolPath);
        }

        String base = String.format("region_%d_%s", regionId, observationId);
        Path pixelFile = workDir.resolve(base + ".pix");
        Path outputFile = workDir.resolve(base + ".spec");
        Path logFile = workDir.resolve(base + ".log");
        Process p = null;
        try {
            Files.createDirectories(workDir);
            writePixels(pixelFile, pixels);
            Files.deleteIfExists(outputFile);

            ProcessBuilder pb = new ProcessBuilder(
                    toolPath,
                    observationId,
                    pixelFile.toAbsolutePath().toString(),
                    outputFile.toAbsolutePath().toString());
            pb.redirectErrorStream(true);
            pb.redirectOutput(logFile.toFile());

            p = pb.start();
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                throw new SpectrumExtractionException(String.format(
                        "Extraction of region %d / %s timed out after %s", regionId, observationId, timeout));
            }
            if (p.exitValue() != 0) {
                throw new SpectrumExtractionException(String.format(
                        "Extraction of region %d / %s exited with %d (see %s)", regionId, observationId, p.exitValue(), logFile));
            }
            if (!Files.exists(outputFile)) {
                throw new SpectrumExtractionException("Extraction tool produced no spectrum at " + outputFile);
            }
            Spectrum spectrum = parse(regionId, observationId, Files.readAllLines(outputFile, StandardCharsets.UTF_8));

            Files.deleteIfExists(outputFile);
            Files.deleteIfExists(pixelFile);
            Files.deleteIfExists(logFile);
            return spectrum;
        } catch (IOException e) {
            throw new SpectrumExtractionException("Extraction of region " + regionId + " / " + observationId
                    + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SpectrumExtractionException("Extraction of region " + regionId + " interrupted", e);
        } finally {
            // timed out, interrupted or failed while reading: the tool must not outlive the call
            if (p != null && p.isAlive()) {
                logger.warn("Stopping extraction tool for region {} / {}", regionId, observationId);
                p.destroyForcibly();
            }
        }
    }

    private static void writePixels(Path file, List<Pixel> pixels) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Pixel p : pixels) {
                w.write(p.x + " " + p.y);
                w.write('\n');
            }
        }
    }

    static Spectrum parse(int regionId, String observationId, List<String> lines) throws SpectrumExtractionException {
        double exposure = Double.NaN;
        List<double[]> rows = new ArrayList<>();
        for (String raw : lines) {
            String l = raw.trim();
            if (l.isEmpty() || l.startsWith("#")) continue;
            String[] cols = l.startsWith("EXPOSURE") ? l.split("=") : l.split("\\s+");
            if (cols.length < 2) {
                throw new SpectrumExtractionException("Malformed spectrum line for region " + regionId + ": " + l);
            }
            try {
                if (l.startsWith("EXPOSURE")) {
                    exposure = Double.parseDouble(cols[1].trim());
                    continue;
                }
                double counts = Double.parseDouble(cols[1]);
                double bkg = cols.length > 2 ? Double.parseDouble(cols[2]) : 0.0;
                rows.add(new double[]{counts, bkg});
            } catch (NumberFormatException e) {
                throw new SpectrumExtractionException("Malformed spectrum line for region " + regionId + ": " + l, e);
            }
        }
        if (rows.isEmpty()) throw new SpectrumExtractionException("Empty spectrum for region " + regionId);
        if (!(exposure > 0)) throw new SpectrumExtractionException("Spectrum of region " + regionId + " has no exposure");

        double[] counts = new double[rows.size()];
        double[] bkg = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            counts[i] = rows.get(i)[0];
            bkg[i] = rows.get(i)[1];
        }
        logger.debug("Region {} / {}: {} channels, exposure {}s", regionId, observationId, counts.length, exposure);
        return new Spectrum(regionId, observationId, counts, bkg, exposure);
    }
}
