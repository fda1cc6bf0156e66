package com.demandplanner.forecast;

import java.util.Objects;

public final class ModelForecast {

    private final double[] mean;
    private final double[] lower;
    private final double[] upper;
    private final String unavailableReason;

    private ModelForecast(double[] mean, double[] lower, double[] upper, String unavailableReason) {
        this.mean = mean;
        this.lower = lower;
        this.upper = upper;
        this.unavailableReason = unavailableReason;
    }

    public static ModelForecast of(double[] mean) {
        return new ModelForecast(mean.clone(), null, null, null);
    }

    public static ModelForecast withInterval(double[] mean, double[] lower, double[] upper) {
        if (mean.length != lower.length || mean.length != upper.length) {
            throw new IllegalArgumentException("Interval bounds must match the number of steps");
        }
        return new ModelForecast(mean.clone(), lower.clone(), upper.clone(), null);
    }

    public static ModelForecast unavailable(String reason) {
        return new ModelForecast(null, null, null, Objects.requireNonNull(reason));
    }

    public boolean isAvailable() {
        return unavailableReason == null;
    }

    public boolean hasInterval() {
        return lower != null;
    }

    public int steps() {
        return isAvailable() ? mean.length : 0;
    }

    public double mean(int step) {
        return mean[step];
    }

    public double lower(int step) {
        return lower[step];
    }

    public double upper(int step) {
        return upper[step];
    }

    public String reason() {
        return unavailableReason;
    }

    @Override
    public String toString() {
        return isAvailable()
            ? "ModelForecast[" + mean.length + " steps" + (hasInterval() ? ", interval" : "") + "]"
            : "ModelForecast[unavailable: " + unavailableReason + "]";
    }
}
