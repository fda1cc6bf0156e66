package com.demandplanner.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class BomProportion {

    private static final BomProportion EMPTY = new BomProportion(Map.of(), Map.of());

    private final Map<String, Double> shares;
    private final Map<String, String> labels;

    private BomProportion(Map<String, Double> shares, Map<String, String> labels) {
        this.shares = shares;
        this.labels = labels;
    }

    public static BomProportion empty() {
        return EMPTY;
    }

    public static BomProportion of(Map<String, ? extends Number> unitsByKey) {
        Builder builder = builder();
        unitsByKey.forEach((key, units) -> builder.add(key, key, units != null ? units.doubleValue() : 0.0));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return shares.isEmpty();
    }

    public Set<String> keys() {
        return shares.keySet();
    }

    public Map<String, Double> shares() {
        return shares;
    }

    public double share(String key) {
        return shares.getOrDefault(key, 0.0);
    }

    public String label(String key) {
        return labels.getOrDefault(key, key);
    }

    public double totalShare() {
        return shares.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public static final class Builder {

        private final Map<String, Double> units = new LinkedHashMap<>();
        private final Map<String, String> labels = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String key, String label, double keyUnits) {
            units.merge(key, keyUnits, Double::sum);
            labels.putIfAbsent(key, label != null ? label : key);
            return this;
        }

        public BomProportion build() {
            double total = units.values().stream().filter(u -> u > 0).mapToDouble(Double::doubleValue).sum();
            if (total <= 0) {
                return EMPTY;
            }
            Map<String, Double> shares = new LinkedHashMap<>();
            Map<String, String> keptLabels = new LinkedHashMap<>();
            units.forEach((key, keyUnits) -> {
                if (keyUnits > 0) {
                    shares.put(key, keyUnits / total);
                    keptLabels.put(key, labels.get(key));
                }
            });
            return new BomProportion(Collections.unmodifiableMap(shares), Collections.unmodifiableMap(keptLabels));
        }
    }
}
