package com.demandplanner.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class ForecastRunNotFoundException extends DemandPlannerException {

    private final UUID runId;

    public ForecastRunNotFoundException(UUID runId) {
        super("FORECAST_RUN_NOT_FOUND", "Forecast run with id '" + runId + "' not found.");
        this.runId = runId;
    }
}
