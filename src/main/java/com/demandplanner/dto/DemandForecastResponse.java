package com.demandplanner.dto;

import com.demandplanner.domain.ForecastMethod;
import com.demandplanner.domain.ForecastPoint;
import com.demandplanner.requirements.ExplosionMode;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class DemandForecastResponse {

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    int forecastWeeks;
    ExplosionMode mode;
    double wastagePercent;

    OverallStats overall;
    List<WeekHistory> weeklyHistory;
    ForecastMethod overallMethod;
    List<ForecastPoint> overallForecast;
    List<ForecastPoint> revenueForecast;

    List<ProductForecast> products;
    List<FabricRequirement> fabricRequirements;
    List<PurchaseOrder> purchaseOrders;
    Summary summary;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class OverallStats {
        long totalOrders;
        int weeksOfData;
        DateRange dateRange;
        double recent12wAvg;
        double prev12wAvg;
        double recentAov;
        double prevAov;
        Double yoySamePeriodAvg;
        List<SeasonalityIndex> seasonality;
    }

    @Value
    @Builder
    public static class DateRange {
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate from;
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate to;
    }

    @Value
    @Builder
    public static class SeasonalityIndex {
        String month;
        long index;
    }

    @Value
    @Builder
    public static class WeekHistory {
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate week;
        long orders;
        double revenue;
        double aov;
    }

    @Value
    @Builder
    public static class ProductForecast {
        String name;
        long last12moUnits;
        double recent8wAvg;
        double forecastTotal;
        ForecastMethod method;
        List<ForecastPoint> forecasts;
        List<MixShare> sizeBreakdown;
        List<MixShare> colourBreakdown;
        List<UnitsHistory> history;
    }

    @Value
    @Builder
    public static class MixShare {
        String key;
        String label;
        double pct;
        double units;
    }

    @Value
    @Builder
    public static class UnitsHistory {
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate week;
        long units;
    }

    @Value
    @Builder
    public static class FabricRequirement {
        String name;
        String unit;
        double totalQty;
        List<ColourRequirement> colours;
    }

    @Value
    @Builder
    public static class ColourRequirement {
        String code;
        String colour;
        double required;
        double inStock;
        double gap;
        double toOrder;
        double costPerUnit;
        double orderCost;
        ForecastMethod method;
        List<Driver> drivers;
    }

    @Value
    @Builder
    public static class Driver {
        String product;
        double qty;
        double units;
        ForecastMethod method;
    }

    @Value
    @Builder
    public static class PurchaseOrder {
        String code;
        String fabric;
        String colour;
        String unit;
        double required;
        double inStock;
        double toOrder;
        double costPerUnit;
        double estCost;
        ForecastMethod method;
    }

    @Value
    @Builder
    public static class Summary {
        double totalForecastUnits;
        int productsForecasted;
        int fabricTypesNeeded;
        int fabricColoursNeeded;
        int shortfallCount;
        int coveredByStock;
        double estimatedPurchaseCost;
        Map<String, Integer> methodCounts;
    }
}
