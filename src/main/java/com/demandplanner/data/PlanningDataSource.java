package com.demandplanner.data;

import com.demandplanner.domain.BomLine;
import com.demandplanner.domain.FabricColour;

import java.time.LocalDate;
import java.util.List;

public interface PlanningDataSource {

    List<WeeklyTotal> weeklyTotals();

    List<ProductWeek> weeklyProductUnits();

    List<MixEntry> sizeMix(int lookbackMonths);

    List<MixEntry> variationMix(int lookbackMonths);

    List<BomLine> bomLines();

    List<FabricStock> fabricStock();

    List<FabricWeek> weeklyFabricConsumption(double defaultWastagePercent);

    List<ProductFabricUsage> productFabricConsumption(int lookbackWeeks, double defaultWastagePercent);

    record WeeklyTotal(LocalDate week, long orders, Double revenue, long uniqueCustomers, Double averageOrderValue) {}

    record ProductWeek(LocalDate week, String productName, double units) {}

    record MixEntry(String productName, String key, String label, double units) {}

    record FabricStock(String fabricColourCode, Double currentBalance) {}

    record FabricWeek(LocalDate week, FabricColour fabricColour, double qty) {}

    record ProductFabricUsage(String productName, String fabricColourCode, double qty, double units) {}
}
