package com.clustermap.model;

import java.time.Duration;
import java.util.prefs.Preferences;

/**
 * User-level tuning of the binning and fitting stages, persisted with {@link Preferences}.
 * The engine never reads this class directly; callers take a snapshot with
 * {@link #binningParameters()} or {@link #fitPoolSettings()}.
 */
public class PipelineConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(PipelineConfig.class);

    // Binning
    private static final String KEY_SN_TARGET = "signal_to_noise_threshold";
    private static final String KEY_RESOLUTION = "resolution";
    private static final String KEY_EXPOSURE_FLOOR = "exposure_floor";
    private static final String KEY_RADIUS_STEP = "radius_step";
    private static final String KEY_MAX_RADIUS = "max_radius";
    private static final String KEY_BACKGROUND = "background_per_pixel";

    // Fitting
    private static final String KEY_NUM_CPUS = "num_cpus";
    private static final String KEY_FIT_TIMEOUT = "fit_timeout_seconds";
    private static final String KEY_START_TEMP = "start_temperature_kev";
    private static final String KEY_MIN_COUNTS = "minimum_net_counts";

    // External extraction tool
    private static final String KEY_EXTRACT_TOOL = "extract_tool_path";
    private static final String KEY_EXTRACT_TIMEOUT = "extract_timeout_seconds";

    public static int getSignalToNoise() { return prefs.getInt(KEY_SN_TARGET, 50); }
    public static void setSignalToNoise(int v) { prefs.putInt(KEY_SN_TARGET, v); }

    public static Resolution getResolution() { return Resolution.fromLevel(prefs.getInt(KEY_RESOLUTION, 2)); }
    public static void setResolution(Resolution v) { prefs.putInt(KEY_RESOLUTION, v.level()); }

    public static double getExposureFloor() { return prefs.getDouble(KEY_EXPOSURE_FLOOR, 0.0); }
    public static void setExposureFloor(double v) { prefs.putDouble(KEY_EXPOSURE_FLOOR, v); }

    public static double getRadiusStep() { return prefs.getDouble(KEY_RADIUS_STEP, 1.0); }
    public static void setRadiusStep(double v) { prefs.putDouble(KEY_RADIUS_STEP, v); }

    public static double getMaxRadius() { return prefs.getDouble(KEY_MAX_RADIUS, 100.0); }
    public static void setMaxRadius(double v) { prefs.putDouble(KEY_MAX_RADIUS, v); }

    public static double getBackgroundPerPixel() { return prefs.getDouble(KEY_BACKGROUND, 0.0); }
    public static void setBackgroundPerPixel(double v) { prefs.putDouble(KEY_BACKGROUND, v); }

    /** 0 means one worker per available processor. */
    public static int getNumCpus() { return prefs.getInt(KEY_NUM_CPUS, 0); }
    public static void setNumCpus(int v) { prefs.putInt(KEY_NUM_CPUS, v); }

    public static long getFitTimeoutSeconds() { return prefs.getLong(KEY_FIT_TIMEOUT, 600); }
    public static void setFitTimeoutSeconds(long v) { prefs.putLong(KEY_FIT_TIMEOUT, v); }

    public static double getStartTemperature() { return prefs.getDouble(KEY_START_TEMP, 5.0); }
    public static void setStartTemperature(double v) { prefs.putDouble(KEY_START_TEMP, v); }

    public static double getMinimumNetCounts() { return prefs.getDouble(KEY_MIN_COUNTS, 1.0); }
    public static void setMinimumNetCounts(double v) { prefs.putDouble(KEY_MIN_COUNTS, v); }

    public static String getExtractToolPath() {
        return prefs.get(KEY_EXTRACT_TOOL, ""); // no default, the user must point at the toolchain wrapper
    }
    public static void setExtractToolPath(String v) { prefs.put(KEY_EXTRACT_TOOL, v); }

    public static long getExtractTimeoutSeconds() { return prefs.getLong(KEY_EXTRACT_TIMEOUT, 300); }
    public static void setExtractTimeoutSeconds(long v) { prefs.putLong(KEY_EXTRACT_TIMEOUT, v); }

    public static BinningParameters binningParameters() {
        return new BinningParameters(getSignalToNoise(), getResolution(), getExposureFloor(),
                getRadiusStep(), getMaxRadius(), getBackgroundPerPixel());
    }

    public static FitPoolSettings fitPoolSettings() {
        int cpus = getNumCpus();
        return new FitPoolSettings(
                cpus > 0 ? cpus : Runtime.getRuntime().availableProcessors(),
                Duration.ofSeconds(getFitTimeoutSeconds()),
                getStartTemperature(),
                getMinimumNetCounts());
    }
}
