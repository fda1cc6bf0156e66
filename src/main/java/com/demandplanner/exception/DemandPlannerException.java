package com.demandplanner.exception;

import lombok.Getter;

@Getter
public abstract class DemandPlannerException extends RuntimeException {

    private final String errorCode;

    protected DemandPlannerException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    protected DemandPlannerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
