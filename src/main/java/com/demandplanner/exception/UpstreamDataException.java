package com.demandplanner.exception;

import lombok.Getter;

@Getter
public class UpstreamDataException extends DemandPlannerException {

    private final String dataset;

    public UpstreamDataException(String dataset, Throwable cause) {
        super("UPSTREAM_DATA_UNAVAILABLE", "Failed to load " + dataset + ": " + cause.getMessage(), cause);
        this.dataset = dataset;
    }
}
