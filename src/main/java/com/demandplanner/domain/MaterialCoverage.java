package com.demandplanner.domain;

public record MaterialCoverage(MaterialRequirement requirement, double inStock) {

    public String code() {
        return requirement.code();
    }

    public double gap() {
        return Math.max(0.0, requirement.requiredQty() - inStock);
    }

    public boolean isCovered() {
        return inStock >= requirement.requiredQty();
    }
}
