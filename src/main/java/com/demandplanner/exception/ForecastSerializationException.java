package com.demandplanner.exception;

public class ForecastSerializationException extends DemandPlannerException {
    public ForecastSerializationException(Throwable cause) {
        super("FORECAST_SERIALIZATION_FAILED", "Forecast result could not be stored: " + cause.getMessage(), cause);
    }
}
