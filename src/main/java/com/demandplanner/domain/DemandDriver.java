package com.demandplanner.domain;

public record DemandDriver(String product, double qty, double units, ForecastMethod method) {
}
