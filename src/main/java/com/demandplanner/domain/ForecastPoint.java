package com.demandplanner.domain;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

public record ForecastPoint(
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate week,
    double forecast,
    double low,
    double high
) {

    public ForecastPoint scale(double factor, int decimals) {
        double unit = Math.pow(10, decimals);
        return new ForecastPoint(week,
            Math.round(forecast * factor * unit) / unit,
            Math.round(low * factor * unit) / unit,
            Math.round(high * factor * unit) / unit);
    }
}
