package com.demandplanner.forecast;

import com.demandplanner.domain.ForecastMethod;
import com.demandplanner.domain.ForecastPoint;

import java.util.List;

public record EnsembleForecast(List<ForecastPoint> points, ForecastMethod method) {

    public EnsembleForecast {
        points = List.copyOf(points);
    }

    public static EnsembleForecast empty() {
        return new EnsembleForecast(List.of(), null);
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public double total() {
        return points.stream().mapToDouble(ForecastPoint::forecast).sum();
    }
}
