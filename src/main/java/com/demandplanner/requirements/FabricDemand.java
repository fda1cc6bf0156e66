package com.demandplanner.requirements;

import com.demandplanner.domain.DemandDriver;
import com.demandplanner.domain.FabricColour;
import com.demandplanner.domain.ForecastMethod;

import java.util.List;

public record FabricDemand(
    FabricColour fabricColour,
    double requiredQty,
    ForecastMethod method,
    List<DemandDriver> recentConsumption
) {

    public FabricDemand {
        recentConsumption = List.copyOf(recentConsumption);
    }
}
