package com.demandplanner.dto;

import com.demandplanner.requirements.ExplosionMode;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ForecastRunSummary {
    UUID id;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    ExplosionMode mode;
    int horizonWeeks;
    double totalForecastUnits;
    int productsForecasted;
    int shortfallCount;
    double estimatedPurchaseCost;
    String requestId;
}
