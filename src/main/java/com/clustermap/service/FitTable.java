package com.clustermap.service;

import com.clustermap.model.FitRecord;
import com.clustermap.model.ParameterEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Append-only checkpoint of spectral fit results, one CSV line per record.
 * <p>
 * Records are never rewritten. A region fitted again (after an earlier failure) gets a new
 * line and the latest line wins. Reopening a table cut short by a crash drops the partial
 * trailing line. Not thread-safe: only the fitting coordinator appends. Readers that only
 * consume results use {@link #load(Path)}.
 */
public class FitTable implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(FitTable.class);

    static final String HEADER = "region,temperature,temperature_lo,temperature_hi,"
            + "abundance,abundance_lo,abundance_hi,"
            + "normalization,normalization_lo,normalization_hi,dof,statistic,status";
    private static final int COLUMNS = 13;

    private final Path file;
    private final Map<Integer, FitRecord> latest = new TreeMap<>();
    private final List<FitRecord> history = new ArrayList<>();
    private BufferedWriter writer;

    private FitTable(Path file) {
        this.file = file;
    }

    public static FitTable open(Path file) throws IOException {
        FitTable table = new FitTable(file);
        if (Files.exists(file) && Files.size(file) > 0) table.dropPartialLine();
        // a crash while writing the header leaves nothing after truncation
        boolean fresh = !Files.exists(file) || Files.size(file) == 0;
        if (!fresh) table.readLines(Files.readAllLines(file, StandardCharsets.UTF_8));
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        table.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        if (fresh) {
            table.writer.write(HEADER);
            table.writer.write('\n');
            table.writer.flush();
        }
        return table;
    }

    /**
     * Reads the latest record per region without opening the table for writing. A partial
     * trailing line is ignored and the file is left as it is.
     */
    public static Map<Integer, FitRecord> load(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        int end = text.lastIndexOf('\n') + 1;
        if (end < text.length()) {
            logger.warn("Fit table {} ends with a partial record ({} chars); ignoring it", file, text.length() - end);
        }
        FitTable table = new FitTable(file);
        table.readLines(text.substring(0, end).lines().collect(Collectors.toList()));
        return table.records();
    }

    public Path file() { return file; }

    public void append(FitRecord record) throws IOException {
        if (writer == null) throw new IllegalStateException("Fit table " + file + " is closed");
        writer.write(format(record));
        writer.write('\n');
        writer.flush();
        latest.put(record.regionId, record);
        history.add(record);
    }

    /** Latest record per region, ordered by region id. */
    public Map<Integer, FitRecord> records() {
        return Collections.unmodifiableMap(new TreeMap<>(latest));
    }

    public Optional<FitRecord> record(int regionId) {
        return Optional.ofNullable(latest.get(regionId));
    }

    public boolean isConverged(int regionId) {
        FitRecord r = latest.get(regionId);
        return r != null && r.isConverged();
    }

    /** Every line in file order, superseded ones included. */
    public List<FitRecord> history() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    @Override
    public void close() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
        }
    }

    private void dropPartialLine() throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = ch.size();
            long keep = size;
            ByteBuffer one = ByteBuffer.allocate(1);
            while (keep > 0) {
                one.clear();
                ch.read(one, keep - 1);
                if (one.get(0) == '\n') break;
                keep--;
            }
            if (keep < size) {
                logger.warn("Fit table {} ends with a partial record ({} bytes); truncating", file, size - keep);
                ch.truncate(keep);
            }
        }
    }

    private void readLines(List<String> lines) throws IOException {
        if (lines.isEmpty()) return;
        if (!HEADER.equals(lines.get(0).trim())) {
            throw new IOException("Not a fit table (unexpected header): " + file);
        }
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) continue;
            FitRecord r = parse(line, i + 1);
            latest.put(r.regionId, r);
            history.add(r);
        }
        logger.info("Loaded {} fit records for {} regions from {}", history.size(), latest.size(), file);
    }

    static String format(FitRecord r) {
        return String.join(",",
                Integer.toString(r.regionId),
                d(r.temperature.value), d(r.temperature.lower), d(r.temperature.upper),
                d(r.abundance.value), d(r.abundance.lower), d(r.abundance.upper),
                d(r.normalization.value), d(r.normalization.lower), d(r.normalization.upper),
                Integer.toString(r.dof),
                d(r.statistic),
                r.status.name().toLowerCase(Locale.ROOT));
    }

    private static FitRecord parse(String line, int lineNumber) throws IOException {
        String[] c = line.split(",", -1);
        if (c.length != COLUMNS) {
            throw new IOException(String.format("Line %d of fit table has %d columns, expected %d", lineNumber, c.length, COLUMNS));
        }
        try {
            return new FitRecord(
                    Integer.parseInt(c[0]),
                    new ParameterEstimate(p(c[1]), p(c[2]), p(c[3])),
                    new ParameterEstimate(p(c[4]), p(c[5]), p(c[6])),
                    new ParameterEstimate(p(c[7]), p(c[8]), p(c[9])),
                    Integer.parseInt(c[10]),
                    p(c[11]),
                    FitRecord.Status.valueOf(c[12].trim().toUpperCase(Locale.ROOT)),
                    "");
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed record on line " + lineNumber + " of fit table: " + e.getMessage(), e);
        }
    }

    private static String d(double v) { return Double.toString(v); }

    private static double p(String s) { return Double.parseDouble(s.trim()); }
}
