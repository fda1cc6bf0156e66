package com.demandplanner.forecast;

public class ModelFitException extends RuntimeException {

    public ModelFitException(String message) {
        super(message);
    }
}
