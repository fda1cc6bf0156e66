package com.demandplanner.requirements;

public enum ExplosionMode {
    ALLOCATION,
    DIRECT
}
