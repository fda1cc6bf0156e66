package com.demandplanner.forecast;

public enum RecursionStrategy {

    CARRY_FORWARD,

    RECOMPUTE
}
