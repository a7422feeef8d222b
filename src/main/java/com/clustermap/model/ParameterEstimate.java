package com.clustermap.model;

import java.util.Objects;

/**
 * Best-fit value with its confidence interval. Symmetric errors are expressed as
 * {@code lower = value - err, upper = value + err}.
 */
public class ParameterEstimate {

    public static final ParameterEstimate MISSING = new ParameterEstimate(Double.NaN, Double.NaN, Double.NaN);

    public final double value;
    public final double lower;
    public final double upper;

    public ParameterEstimate(double value, double lower, double upper) {
        this.value = value;
        this.lower = lower;
        this.upper = upper;
    }

    public static ParameterEstimate symmetric(double value, double error) {
        return new ParameterEstimate(value, value - error, value + error);
    }

    /** Half width of the interval. */
    public double error() { return (upper - lower) / 2.0; }

    public double fractionalError() { return value == 0 ? Double.NaN : error() / Math.abs(value); }

    public ParameterEstimate scaled(double factor) {
        return new ParameterEstimate(value * factor, lower * factor, upper * factor);
    }

    public boolean isFinite() {
        return Double.isFinite(value) && Double.isFinite(lower) && Double.isFinite(upper);
    }

    // NaN equals NaN so MISSING estimates compare equal after a reload
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterEstimate)) return false;
        ParameterEstimate other = (ParameterEstimate) o;
        return Double.compare(value, other.value) == 0
                && Double.compare(lower, other.lower) == 0
                && Double.compare(upper, other.upper) == 0;
    }

    @Override
    public int hashCode() { return Objects.hash(value, lower, upper); }

    @Override
    public String toString() { return value + " [" + lower + ", " + upper + "]"; }
}
