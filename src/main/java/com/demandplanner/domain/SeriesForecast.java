package com.demandplanner.domain;

import java.util.List;

public record SeriesForecast(ForecastMethod method, List<ForecastPoint> points, double total) {

    public SeriesForecast {
        points = List.copyOf(points);
    }
}
