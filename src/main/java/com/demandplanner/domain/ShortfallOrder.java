package com.demandplanner.domain;

public record ShortfallOrder(
    FabricColour fabricColour,
    MaterialRequirement requirement,
    double inStock,
    double toOrder,
    double estimatedCost
) {

    public String code() {
        return fabricColour.code();
    }

    public double requiredQty() {
        return requirement.requiredQty();
    }
}
