package com.demandplanner.domain;

import java.time.LocalDate;
import java.util.Arrays;

// a feature without enough history is NaN
public final class FeatureRow {

    private final LocalDate weekStart;
    private final double target;
    private final double[] features;

    public FeatureRow(LocalDate weekStart, double target, double[] features) {
        if (features.length != Feature.COUNT) {
            throw new IllegalArgumentException(
                "Expected " + Feature.COUNT + " features but got " + features.length);
        }
        this.weekStart = weekStart;
        this.target = target;
        this.features = features.clone();
    }

    public LocalDate weekStart() {
        return weekStart;
    }

    public double target() {
        return target;
    }

    public double get(Feature feature) {
        return features[feature.ordinal()];
    }

    public boolean isMissing(Feature feature) {
        return Double.isNaN(features[feature.ordinal()]);
    }

    public boolean isComplete() {
        return Arrays.stream(features).noneMatch(Double::isNaN);
    }

    public double[] vector() {
        return features.clone();
    }

    @Override
    public String toString() {
        return "FeatureRow[" + weekStart + ", target=" + target + ", " + Arrays.toString(features) + "]";
    }
}
