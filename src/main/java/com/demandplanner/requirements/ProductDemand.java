package com.demandplanner.requirements;

import com.demandplanner.domain.BomProportion;
import com.demandplanner.domain.ForecastMethod;

public record ProductDemand(
    String product,
    double units,
    ForecastMethod method,
    BomProportion variationMix,
    BomProportion sizeMix
) {
}
