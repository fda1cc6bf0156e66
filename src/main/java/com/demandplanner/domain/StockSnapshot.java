package com.demandplanner.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class StockSnapshot {

    private final Map<String, Double> balances;

    private StockSnapshot(Map<String, Double> balances) {
        this.balances = balances;
    }

    // null balances read as zero
    public static StockSnapshot of(Map<String, Double> balances) {
        Map<String, Double> copy = new LinkedHashMap<>();
        balances.forEach((code, balance) -> copy.put(code, balance != null ? balance : 0.0));
        return new StockSnapshot(Collections.unmodifiableMap(copy));
    }

    public double balanceOf(String code) {
        return balances.getOrDefault(code, 0.0);
    }

    public Map<String, Double> balances() {
        return balances;
    }
}
