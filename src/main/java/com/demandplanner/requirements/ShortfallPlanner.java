package com.demandplanner.requirements;

import com.demandplanner.domain.MaterialCoverage;
import com.demandplanner.domain.MaterialDemand;
import com.demandplanner.domain.MaterialRequirement;
import com.demandplanner.domain.ShortfallOrder;
import com.demandplanner.domain.ShortfallPlan;
import com.demandplanner.domain.StockSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Component
public class ShortfallPlanner {

    public ShortfallPlan plan(MaterialDemand demand, StockSnapshot stock) {
        List<MaterialCoverage> coverage = new ArrayList<>(demand.size());
        List<ShortfallOrder> orders = new ArrayList<>();
        int covered = 0;
        double totalCost = 0.0;

        for (MaterialRequirement requirement : demand.requirements()) {
            double inStock = stock.balanceOf(requirement.code());
            MaterialCoverage line = new MaterialCoverage(requirement, inStock);
            coverage.add(line);
            if (line.isCovered()) {
                covered++;
            }
            double gap = requirement.requiredQty() - inStock;
            if (gap > 0) {
                double cost = gap * requirement.fabricColour().costOrZero();
                orders.add(new ShortfallOrder(requirement.fabricColour(), requirement, inStock, gap, cost));
                totalCost += cost;
            }
        }

        // List.sort is stable
        orders.sort(Comparator.comparingDouble(ShortfallOrder::requiredQty).reversed());
        log.info("Shortfalls planned | colours={} | shortfalls={} | covered={} | cost={}",
            coverage.size(), orders.size(), covered, Math.round(totalCost));
        return new ShortfallPlan(coverage, orders, covered, totalCost);
    }
}
