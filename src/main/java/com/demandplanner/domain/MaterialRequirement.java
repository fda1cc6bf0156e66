package com.demandplanner.domain;

import java.util.List;

public record MaterialRequirement(
    FabricColour fabricColour,
    double requiredQty,
    ForecastMethod method,
    List<DemandDriver> drivers
) {

    public MaterialRequirement {
        drivers = List.copyOf(drivers);
    }

    public String code() {
        return fabricColour.code();
    }
}
