package com.demandplanner.service;

import com.demandplanner.config.PlanningConfig;
import com.demandplanner.data.PlanningDataSource;
import com.demandplanner.data.PlanningDataSource.FabricWeek;
import com.demandplanner.data.PlanningDataSource.MixEntry;
import com.demandplanner.data.PlanningDataSource.ProductFabricUsage;
import com.demandplanner.data.PlanningDataSource.ProductWeek;
import com.demandplanner.data.PlanningDataSource.WeeklyTotal;
import com.demandplanner.domain.BomLine;
import com.demandplanner.domain.BomProportion;
import com.demandplanner.domain.BomTable;
import com.demandplanner.domain.DemandDriver;
import com.demandplanner.domain.FabricColour;
import com.demandplanner.domain.ForecastMethod;
import com.demandplanner.domain.ForecastPoint;
import com.demandplanner.domain.MaterialCoverage;
import com.demandplanner.domain.MaterialDemand;
import com.demandplanner.domain.MaterialRequirement;
import com.demandplanner.domain.SeriesForecast;
import com.demandplanner.domain.ShortfallOrder;
import com.demandplanner.domain.ShortfallPlan;
import com.demandplanner.domain.StockSnapshot;
import com.demandplanner.domain.WeeklySeries;
import com.demandplanner.dto.DemandForecastResponse;
import com.demandplanner.forecast.ForecastMethodSelector;
import com.demandplanner.forecast.SeasonalModelConfig;
import com.demandplanner.requirements.ExplosionMode;
import com.demandplanner.requirements.FabricDemand;
import com.demandplanner.requirements.ProductDemand;
import com.demandplanner.requirements.RequirementsExplosionEngine;
import com.demandplanner.requirements.ShortfallPlanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class DemandPlanningService {

    static final List<String> SIZE_ORDER = List.of("XS", "S", "M", "L", "XL", "2XL", "3XL");
    static final int PRODUCT_HISTORY_WEEKS = 26;

    private final PlanningDataSource dataSource;
    private final ForecastMethodSelector methodSelector;
    private final RequirementsExplosionEngine explosionEngine;
    private final ShortfallPlanner shortfallPlanner;
    private final OverallStatisticsCalculator statisticsCalculator;
    private final Clock clock;

    public DemandForecastResponse run(PlanningConfig config) {
        UpstreamData data = load(config);
        Map<String, Integer> methodCounts = new LinkedHashMap<>();

        List<WeeklyTotal> weeks = statisticsCalculator.trimPartialWeeks(data.totals());
        WeeklySeries orderSeries = WeeklySeries.of(weeks.stream()
            .collect(Collectors.toMap(WeeklyTotal::week, WeeklyTotal::orders, Long::sum)));
        Optional<SeriesForecast> overall = methodSelector.select(orderSeries, config, SeasonalModelConfig.PRODUCT);
        overall.ifPresent(forecast -> count(methodCounts, forecast.method()));
        List<ForecastPoint> overallPoints = overall.map(SeriesForecast::points).orElse(List.of());
        double recentAov = statisticsCalculator.recentAov(weeks);
        List<ForecastPoint> revenuePoints = overallPoints.stream().map(p -> p.scale(recentAov, 0)).toList();
        log.info("Overall forecast | weeks={} | method={} | points={}",
            orderSeries.size(), overall.map(SeriesForecast::method).orElse(null), overallPoints.size());

        BomTable bom = BomTable.of(data.bomLines());
        List<DemandForecastResponse.ProductForecast> productForecasts = new ArrayList<>();
        MaterialDemand demand;
        if (config.mode() == ExplosionMode.DIRECT) {
            demand = explodeFabrics(data, config, bom, methodCounts);
        } else {
            demand = explodeProducts(data, config, bom, methodCounts, productForecasts);
        }

        ShortfallPlan plan = shortfallPlanner.plan(demand, stockSnapshot(data));
        List<DemandForecastResponse.FabricRequirement> fabricGroups = fabricGroups(plan);
        List<DemandForecastResponse.PurchaseOrder> purchaseOrders = plan.orders().stream()
            .map(DemandPlanningService::toPurchaseOrder)
            .toList();

        DemandForecastResponse.Summary summary = DemandForecastResponse.Summary.builder()
            .totalForecastUnits(round(productForecasts.stream()
                .mapToDouble(DemandForecastResponse.ProductForecast::getForecastTotal).sum(), 0))
            .productsForecasted(productForecasts.size())
            .fabricTypesNeeded(fabricGroups.size())
            .fabricColoursNeeded(demand.size())
            .shortfallCount(purchaseOrders.size())
            .coveredByStock(plan.coveredByStock())
            .estimatedPurchaseCost(purchaseOrders.stream()
                .mapToDouble(DemandForecastResponse.PurchaseOrder::getEstCost).sum())
            .methodCounts(methodCounts)
            .build();

        log.info("Planning run complete | mode={} | products={} | colours={} | shortfalls={}",
            config.mode(), productForecasts.size(), demand.size(), purchaseOrders.size());

        return DemandForecastResponse.builder()
            .generatedAt(Instant.now(clock))
            .forecastWeeks(config.horizonWeeks())
            .mode(config.mode())
            .wastagePercent(config.defaultWastagePercent())
            .overall(statisticsCalculator.stats(weeks))
            .weeklyHistory(statisticsCalculator.history(weeks))
            .overallMethod(overall.map(SeriesForecast::method).orElse(null))
            .overallForecast(overallPoints)
            .revenueForecast(revenuePoints)
            .products(productForecasts)
            .fabricRequirements(fabricGroups)
            .purchaseOrders(purchaseOrders)
            .summary(summary)
            .build();
    }

    private UpstreamData load(PlanningConfig config) {
        log.info("Loading planning data | mode={} | horizon={}", config.mode(), config.horizonWeeks());
        boolean direct = config.mode() == ExplosionMode.DIRECT;
        return new UpstreamData(
            dataSource.weeklyTotals(),
            direct ? List.of() : dataSource.weeklyProductUnits(),
            direct ? List.of() : dataSource.sizeMix(config.mixLookbackMonths()),
            direct ? List.of() : dataSource.variationMix(config.mixLookbackMonths()),
            dataSource.bomLines(),
            dataSource.fabricStock(),
            direct ? dataSource.weeklyFabricConsumption(config.defaultWastagePercent()) : List.of(),
            direct ? dataSource.productFabricConsumption(config.driverLookbackWeeks(), config.defaultWastagePercent())
                   : List.of());
    }

    private MaterialDemand explodeProducts(UpstreamData data, PlanningConfig config, BomTable bom,
                                           Map<String, Integer> methodCounts,
                                           List<DemandForecastResponse.ProductForecast> productForecasts) {
        Map<String, WeeklySeries> seriesByProduct = productSeries(data.productWeeks());
        Map<String, BomProportion> sizeMix = proportions(data.sizeMix());
        Map<String, BomProportion> variationMix = proportions(data.variationMix());
        Map<String, Double> ranking = rankProducts(data.productWeeks(), config);

        List<ProductDemand> demands = new ArrayList<>();
        Set<String> modelled = new HashSet<>();
        ranking.entrySet().stream().limit(config.modelProductLimit()).forEach(ranked -> {
            String product = ranked.getKey();
            WeeklySeries series = seriesByProduct.getOrDefault(product, WeeklySeries.empty());
            Optional<SeriesForecast> forecast = methodSelector.select(series, config, SeasonalModelConfig.PRODUCT);
            if (forecast.isEmpty()) {
                log.debug("Product skipped | product={} | weeks={}", product, series.size());
                return;
            }
            modelled.add(product);
            SeriesForecast chosen = forecast.get();
            count(methodCounts, chosen.method());
            BomProportion sizes = sizeMix.getOrDefault(product, BomProportion.empty());
            BomProportion variations = variationMix.getOrDefault(product, BomProportion.empty());
            productForecasts.add(toProductForecast(product, ranked.getValue(), series, chosen, sizes, variations));
            demands.add(new ProductDemand(product, chosen.total(), chosen.method(), variations, sizes));
        });

        // every other product with a mix and a BOM gets a trailing-average projection
        Set<String> remaining = new TreeSet<>(sizeMix.keySet());
        remaining.retainAll(variationMix.keySet());
        remaining.retainAll(bom.products());
        remaining.removeAll(modelled);
        int averaged = 0;
        for (String product : remaining) {
            Optional<SeriesForecast> forecast = methodSelector.averageOnly(
                seriesByProduct.getOrDefault(product, WeeklySeries.empty()), config);
            if (forecast.isEmpty()) {
                continue;
            }
            averaged++;
            count(methodCounts, forecast.get().method());
            demands.add(new ProductDemand(product, forecast.get().total(), forecast.get().method(),
                variationMix.get(product), sizeMix.get(product)));
        }
        log.info("Product forecasts | modelled={} | averaged={}", modelled.size(), averaged);

        return explosionEngine.explode(ExplosionMode.ALLOCATION, demands, List.of(), bom,
            config.defaultWastagePercent());
    }

    private MaterialDemand explodeFabrics(UpstreamData data, PlanningConfig config, BomTable bom,
                                          Map<String, Integer> methodCounts) {
        Map<String, FabricColour> colours = new TreeMap<>();
        Map<String, Map<LocalDate, Double>> consumption = new TreeMap<>();
        for (FabricWeek row : data.fabricWeeks()) {
            String code = row.fabricColour().code();
            colours.putIfAbsent(code, row.fabricColour());
            consumption.computeIfAbsent(code, c -> new TreeMap<>()).merge(row.week(), row.qty(), Double::sum);
        }
        Map<String, List<DemandDriver>> recentByCode = new LinkedHashMap<>();
        for (ProductFabricUsage usage : data.productUsage()) {
            recentByCode.computeIfAbsent(usage.fabricColourCode(), c -> new ArrayList<>())
                .add(new DemandDriver(usage.productName(), usage.qty(), usage.units(), null));
        }

        List<FabricDemand> demands = new ArrayList<>();
        consumption.forEach((code, weekly) -> {
            Optional<SeriesForecast> forecast = methodSelector.select(
                WeeklySeries.of(weekly), config, SeasonalModelConfig.FABRIC);
            forecast.ifPresent(chosen -> {
                count(methodCounts, chosen.method());
                demands.add(new FabricDemand(colours.get(code), chosen.total(), chosen.method(),
                    recentByCode.getOrDefault(code, List.of())));
            });
        });
        log.info("Fabric forecasts | colours={} | forecast={} | bomLines={}",
            consumption.size(), demands.size(), bom.size());

        return explosionEngine.explode(ExplosionMode.DIRECT, List.of(), demands, bom,
            config.defaultWastagePercent());
    }

    private Map<String, Double> rankProducts(List<ProductWeek> productWeeks, PlanningConfig config) {
        LocalDate cutoff = LocalDate.now(clock).minusDays(config.rankingLookbackDays());
        Map<String, Double> units = productWeeks.stream()
            .filter(row -> !row.week().isBefore(cutoff))
            .collect(Collectors.groupingBy(ProductWeek::productName, Collectors.summingDouble(ProductWeek::units)));
        return units.entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.<String, Double>comparingByKey()))
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    private static Map<String, WeeklySeries> productSeries(List<ProductWeek> productWeeks) {
        Map<String, Map<LocalDate, Double>> byProduct = new LinkedHashMap<>();
        for (ProductWeek row : productWeeks) {
            byProduct.computeIfAbsent(row.productName(), p -> new TreeMap<>())
                .merge(row.week(), row.units(), Double::sum);
        }
        Map<String, WeeklySeries> series = new LinkedHashMap<>();
        byProduct.forEach((product, weekly) -> series.put(product, WeeklySeries.of(weekly)));
        return series;
    }

    private static Map<String, BomProportion> proportions(List<MixEntry> entries) {
        Map<String, BomProportion.Builder> builders = new LinkedHashMap<>();
        for (MixEntry entry : entries) {
            builders.computeIfAbsent(entry.productName(), p -> BomProportion.builder())
                .add(entry.key(), entry.label(), entry.units());
        }
        Map<String, BomProportion> proportions = new LinkedHashMap<>();
        builders.forEach((product, builder) -> {
            BomProportion proportion = builder.build();
            if (!proportion.isEmpty()) {
                proportions.put(product, proportion);
            }
        });
        return proportions;
    }

    private static StockSnapshot stockSnapshot(UpstreamData data) {
        Map<String, Double> balances = new LinkedHashMap<>();
        for (PlanningDataSource.FabricStock row : data.stock()) {
            balances.merge(row.fabricColourCode(),
                row.currentBalance() != null ? row.currentBalance() : 0.0, Double::sum);
        }
        return StockSnapshot.of(balances);
    }

    private static DemandForecastResponse.ProductForecast toProductForecast(
            String product, double lastYearUnits, WeeklySeries series, SeriesForecast forecast,
            BomProportion sizes, BomProportion variations) {
        double total = round(forecast.total(), 0);

        List<DemandForecastResponse.MixShare> sizeBreakdown = new ArrayList<>();
        for (String size : SIZE_ORDER) {
            if (sizes.keys().contains(size)) {
                sizeBreakdown.add(mixShare(size, sizes.label(size), sizes.share(size), forecast.total()));
            }
        }
        List<DemandForecastResponse.MixShare> colourBreakdown = variations.shares().entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
            .map(e -> mixShare(e.getKey(), variations.label(e.getKey()), e.getValue(), forecast.total()))
            .toList();

        WeeklySeries recent = series.tail(PRODUCT_HISTORY_WEEKS);
        List<DemandForecastResponse.UnitsHistory> history = new ArrayList<>(recent.size());
        for (int i = 0; i < recent.size(); i++) {
            history.add(DemandForecastResponse.UnitsHistory.builder()
                .week(recent.weekAt(i))
                .units(Math.round(recent.valueAt(i)))
                .build());
        }

        return DemandForecastResponse.ProductForecast.builder()
            .name(product)
            .last12moUnits(Math.round(lastYearUnits))
            .recent8wAvg(round(series.trailingMean(8), 1))
            .forecastTotal(total)
            .method(forecast.method())
            .forecasts(forecast.points())
            .sizeBreakdown(sizeBreakdown)
            .colourBreakdown(colourBreakdown)
            .history(history)
            .build();
    }

    private static DemandForecastResponse.MixShare mixShare(String key, String label, double share, double total) {
        return DemandForecastResponse.MixShare.builder()
            .key(key)
            .label(label)
            .pct(round(share * 100.0, 1))
            .units(round(total * share, 0))
            .build();
    }

    private static List<DemandForecastResponse.FabricRequirement> fabricGroups(ShortfallPlan plan) {
        Map<String, List<MaterialCoverage>> byFabric = new LinkedHashMap<>();
        for (MaterialCoverage line : plan.coverage()) {
            byFabric.computeIfAbsent(line.requirement().fabricColour().fabricName(), f -> new ArrayList<>()).add(line);
        }

        List<FabricGroup> groups = new ArrayList<>();
        byFabric.forEach((fabric, lines) -> groups.add(new FabricGroup(fabric,
            lines.get(0).requirement().fabricColour().unit(),
            lines.stream().mapToDouble(l -> l.requirement().requiredQty()).sum(),
            lines)));
        groups.sort(Comparator.comparingDouble(FabricGroup::totalQty).reversed());

        return groups.stream()
            .map(group -> DemandForecastResponse.FabricRequirement.builder()
                .name(group.name())
                .unit(group.unit())
                .totalQty(round(group.totalQty(), 1))
                .colours(group.lines().stream()
                    .sorted(Comparator.comparingDouble((MaterialCoverage l) -> l.requirement().requiredQty()).reversed())
                    .map(DemandPlanningService::toColourRequirement)
                    .toList())
                .build())
            .toList();
    }

    private static DemandForecastResponse.ColourRequirement toColourRequirement(MaterialCoverage line) {
        MaterialRequirement requirement = line.requirement();
        FabricColour colour = requirement.fabricColour();
        double gap = requirement.requiredQty() - line.inStock();
        return DemandForecastResponse.ColourRequirement.builder()
            .code(colour.code())
            .colour(colour.colourName())
            .required(round(requirement.requiredQty(), 1))
            .inStock(round(line.inStock(), 1))
            .gap(round(gap, 1))
            .toOrder(round(line.gap(), 1))
            .costPerUnit(colour.costOrZero())
            .orderCost(round(line.gap() * colour.costOrZero(), 0))
            .method(requirement.method())
            .drivers(requirement.drivers().stream()
                .map(d -> DemandForecastResponse.Driver.builder()
                    .product(d.product())
                    .qty(round(d.qty(), 1))
                    .units(round(d.units(), 1))
                    .method(d.method())
                    .build())
                .toList())
            .build();
    }

    private static DemandForecastResponse.PurchaseOrder toPurchaseOrder(ShortfallOrder order) {
        FabricColour colour = order.fabricColour();
        return DemandForecastResponse.PurchaseOrder.builder()
            .code(colour.code())
            .fabric(colour.fabricName())
            .colour(colour.colourName())
            .unit(colour.unit())
            .required(round(order.requiredQty(), 1))
            .inStock(round(order.inStock(), 1))
            .toOrder(round(order.toOrder(), 1))
            .costPerUnit(colour.costOrZero())
            .estCost(round(order.estimatedCost(), 0))
            .method(order.requirement().method())
            .build();
    }

    private static void count(Map<String, Integer> methodCounts, ForecastMethod method) {
        methodCounts.merge(method.label(), 1, Integer::sum);
    }

    private static double round(double value, int decimals) {
        double unit = Math.pow(10, decimals);
        return Math.round(value * unit) / unit;
    }

    private record FabricGroup(String name, String unit, double totalQty, List<MaterialCoverage> lines) {}

    private record UpstreamData(
        List<WeeklyTotal> totals,
        List<ProductWeek> productWeeks,
        List<MixEntry> sizeMix,
        List<MixEntry> variationMix,
        List<BomLine> bomLines,
        List<PlanningDataSource.FabricStock> stock,
        List<FabricWeek> fabricWeeks,
        List<ProductFabricUsage> productUsage
    ) {}
}
