package com.demandplanner.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class MaterialDemand {

    private static final MaterialDemand EMPTY = new MaterialDemand(Map.of());

    private final Map<String, MaterialRequirement> requirements;

    private MaterialDemand(Map<String, MaterialRequirement> requirements) {
        this.requirements = requirements;
    }

    public static MaterialDemand empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Collection<MaterialRequirement> requirements() {
        return requirements.values();
    }

    public Optional<MaterialRequirement> get(String code) {
        return Optional.ofNullable(requirements.get(code));
    }

    public double requiredQty(String code) {
        MaterialRequirement requirement = requirements.get(code);
        return requirement != null ? requirement.requiredQty() : 0.0;
    }

    public int size() {
        return requirements.size();
    }

    public boolean isEmpty() {
        return requirements.isEmpty();
    }

    @Override
    public String toString() {
        return "MaterialDemand" + requirements.keySet();
    }

    public static final class Builder {

        private final Map<String, FabricColour> colours = new LinkedHashMap<>();
        private final Map<String, Double> quantities = new LinkedHashMap<>();
        private final Map<String, Map<String, DriverTotals>> drivers = new LinkedHashMap<>();
        private final Map<String, ForecastMethod> undrivenMethods = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(FabricColour colour, double qty, String product, double units, ForecastMethod method) {
            String code = colour.code();
            colours.putIfAbsent(code, colour);
            quantities.merge(code, qty, Double::sum);
            drivers.computeIfAbsent(code, c -> new LinkedHashMap<>())
                .computeIfAbsent(product, p -> new DriverTotals(method))
                .add(qty, units);
            return this;
        }

        public Builder add(FabricColour colour, double qty, ForecastMethod method) {
            String code = colour.code();
            colours.putIfAbsent(code, colour);
            quantities.merge(code, qty, Double::sum);
            drivers.computeIfAbsent(code, c -> new LinkedHashMap<>());
            undrivenMethods.putIfAbsent(code, method);
            return this;
        }

        public MaterialDemand build() {
            if (colours.isEmpty()) {
                return EMPTY;
            }
            Map<String, MaterialRequirement> built = new LinkedHashMap<>();
            colours.forEach((code, colour) -> {
                List<DemandDriver> codeDrivers = new ArrayList<>();
                drivers.get(code).forEach((product, totals) ->
                    codeDrivers.add(new DemandDriver(product, totals.qty, totals.units, totals.method)));
                codeDrivers.sort(Comparator.comparingDouble(DemandDriver::qty).reversed()
                    .thenComparing(DemandDriver::product));
                ForecastMethod method = codeDrivers.isEmpty()
                    ? undrivenMethods.get(code)
                    : codeDrivers.get(0).method();
                built.put(code, new MaterialRequirement(colour, quantities.get(code), method, codeDrivers));
            });
            return new MaterialDemand(Collections.unmodifiableMap(built));
        }
    }

    private static final class DriverTotals {

        private final ForecastMethod method;
        private double qty;
        private double units;

        private DriverTotals(ForecastMethod method) {
            this.method = method;
        }

        private void add(double addedQty, double addedUnits) {
            qty += addedQty;
            units += addedUnits;
        }
    }
}
