package com.demandplanner.requirements;

import com.demandplanner.domain.BomLine;
import com.demandplanner.domain.BomTable;
import com.demandplanner.domain.DemandDriver;
import com.demandplanner.domain.FabricColour;
import com.demandplanner.domain.MaterialDemand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class RequirementsExplosionEngine {

    public MaterialDemand explode(ExplosionMode mode, List<ProductDemand> products, List<FabricDemand> fabrics,
                                  BomTable bom, double defaultWastagePercent) {
        MaterialDemand.Builder builder = MaterialDemand.builder();
        if (mode == ExplosionMode.DIRECT) {
            fabrics.forEach(fabric -> applyDirect(builder, fabric));
        } else {
            products.forEach(product -> allocate(builder, product, bom, defaultWastagePercent));
        }
        MaterialDemand demand = builder.build();
        log.info("Requirements exploded | mode={} | colours={}", mode, demand.size());
        return demand;
    }

    public void allocate(MaterialDemand.Builder builder, ProductDemand demand, BomTable bom,
                         double defaultWastagePercent) {
        if (demand.units() <= 0 || demand.variationMix().isEmpty() || demand.sizeMix().isEmpty()) {
            log.debug("Nothing to allocate | product={} | units={}", demand.product(), demand.units());
            return;
        }

        for (Map.Entry<String, Double> variation : demand.variationMix().shares().entrySet()) {
            double variationUnits = demand.units() * variation.getValue();
            for (Map.Entry<String, Double> size : demand.sizeMix().shares().entrySet()) {
                double nodeUnits = variationUnits * size.getValue();
                List<BomLine> lines = bom.linesFor(variation.getKey(), size.getKey());
                if (lines.isEmpty()) {
                    log.debug("No BOM lines | product={} | variation={} | size={}",
                        demand.product(), variation.getKey(), size.getKey());
                    continue;
                }

                // one driver entry per colour per node, even when several lines share the colour
                Map<String, FabricColour> colours = new LinkedHashMap<>();
                Map<String, Double> quantities = new LinkedHashMap<>();
                for (BomLine line : lines) {
                    String code = line.fabricColour().code();
                    colours.putIfAbsent(code, line.fabricColour());
                    quantities.merge(code, nodeUnits * line.consumptionPerUnit(defaultWastagePercent), Double::sum);
                }
                quantities.forEach((code, qty) ->
                    builder.add(colours.get(code), qty, demand.product(), nodeUnits, demand.method()));
            }
        }
    }

    public void applyDirect(MaterialDemand.Builder builder, FabricDemand demand) {
        if (demand.requiredQty() <= 0) {
            return;
        }
        double recentTotal = demand.recentConsumption().stream()
            .mapToDouble(DemandDriver::qty)
            .filter(qty -> qty > 0)
            .sum();
        if (recentTotal <= 0) {
            builder.add(demand.fabricColour(), demand.requiredQty(), demand.method());
            return;
        }

        double scale = demand.requiredQty() / recentTotal;
        for (DemandDriver recent : demand.recentConsumption()) {
            if (recent.qty() > 0) {
                builder.add(demand.fabricColour(), recent.qty() * scale, recent.product(),
                    recent.units() * scale, demand.method());
            }
        }
    }
}
