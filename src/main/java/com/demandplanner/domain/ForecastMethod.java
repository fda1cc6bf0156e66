package com.demandplanner.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastMethod {
    SEASONAL("seasonal"),
    TREE("tree"),
    ENSEMBLE("ensemble"),
    AVERAGE_FALLBACK("average-fallback");

    private final String label;

    ForecastMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
