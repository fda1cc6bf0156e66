package com.demandplanner.domain;

public record FabricColour(String code, String fabricName, String unit, String colourName, Double costPerUnit) {

    public double costOrZero() {
        return costPerUnit != null && costPerUnit > 0 ? costPerUnit : 0.0;
    }
}
