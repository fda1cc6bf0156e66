package com.demandplanner.domain;

import java.util.List;

public record ShortfallPlan(
    List<MaterialCoverage> coverage,
    List<ShortfallOrder> orders,
    int coveredByStock,
    double estimatedPurchaseCost
) {

    public ShortfallPlan {
        coverage = List.copyOf(coverage);
        orders = List.copyOf(orders);
    }
}
