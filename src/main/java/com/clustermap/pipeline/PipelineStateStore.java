package com.clustermap.pipeline;

import com.clustermap.model.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Keeps a cluster's {@link PipelineState} in {@code pipeline.properties} inside the
 * cluster directory so a later run continues after the last completed stage.
 */
public class PipelineStateStore {

    private static final Logger logger = LoggerFactory.getLogger(PipelineStateStore.class);

    public static final String FILE_NAME = "pipeline.properties";
    static final String KEY_NAME = "cluster_name";
    static final String KEY_LAST_STEP = "last_step_completed";

    private final Path file;

    public PipelineStateStore(Path clusterDir) {
        this.file = clusterDir.resolve(FILE_NAME);
    }

    public Path file() { return file; }

    /** Returns the initial state when nothing has been saved for this cluster yet. */
    public PipelineState load(String clusterName) throws IOException {
        if (!Files.isRegularFile(file)) {
            return PipelineState.initial(clusterName);
        }
        Properties props = new Properties();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(r);
        }
        String stored = props.getProperty(KEY_NAME, clusterName);
        if (!stored.equals(clusterName)) {
            throw new IOException(file + " belongs to cluster " + stored + ", not " + clusterName);
        }
        try {
            int last = Integer.parseInt(props.getProperty(KEY_LAST_STEP, "0").trim());
            return new PipelineState(clusterName, last);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid " + KEY_LAST_STEP + " in " + file + ": " + e.getMessage(), e);
        }
    }

    public void save(PipelineState state) throws IOException {
        Properties props = new Properties();
        props.setProperty(KEY_NAME, state.clusterName);
        props.setProperty(KEY_LAST_STEP, Integer.toString(state.lastCompletedStage));
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            props.store(w, "cluster pipeline state");
        }
        logger.debug("Saved state of {}: last completed stage {}", state.clusterName, state.lastCompletedStage);
    }
}
