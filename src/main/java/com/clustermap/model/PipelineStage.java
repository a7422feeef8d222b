package com.clustermap.model;

/**
 * The seven stages of the reduction pipeline. Stages 1 to 4 run in the external
 * calibration toolchain; this project implements 5 to 7.
 */
public enum PipelineStage {
    DOWNLOAD_DATA(1, "download data"),
    REMOVE_SOURCES(2, "remove point sources"),
    GENERATE_RESPONSES(3, "generate responses"),
    CROP_DATA(4, "crop data"),
    CREATE_BINS(5, "adaptive circular binning"),
    FIT_SPECTRA(6, "spectral fitting"),
    TEMPERATURE_MAP(7, "temperature map");

    private final int number;
    private final String description;

    PipelineStage(int number, String description) {
        this.number = number;
        this.description = description;
    }

    public int number() { return number; }
    public String description() { return description; }

    public static PipelineStage of(int number) {
        for (PipelineStage s : values()) {
            if (s.number == number) return s;
        }
        throw new IllegalArgumentException("No pipeline stage " + number);
    }

    @Override
    public String toString() {
        return "Stage " + number + " (" + description + ")";
    }
}
