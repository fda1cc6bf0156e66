package com.demandplanner.domain;

public record BomLine(
    String productName,
    String variationKey,
    String size,
    FabricColour fabricColour,
    double qtyPerUnit,
    Double wastagePercent
) {

    public double effectiveWastagePercent(double defaultWastagePercent) {
        return wastagePercent != null && wastagePercent > 0 ? wastagePercent : defaultWastagePercent;
    }

    public double consumptionPerUnit(double defaultWastagePercent) {
        return qtyPerUnit * (1 + effectiveWastagePercent(defaultWastagePercent) / 100.0);
    }
}
