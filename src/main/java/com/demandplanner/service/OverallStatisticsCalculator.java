package com.demandplanner.service;

import com.demandplanner.data.PlanningDataSource.WeeklyTotal;
import com.demandplanner.dto.DemandForecastResponse;
import org.springframework.stereotype.Component;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Component
public class OverallStatisticsCalculator {

    static final int RECENT_WEEKS = 12;
    static final int HISTORY_WEEKS = 52;
    static final int YOY_FROM = 56;
    static final int YOY_TO = 48;

    // first and last week are usually partial
    public List<WeeklyTotal> trimPartialWeeks(List<WeeklyTotal> totals) {
        List<WeeklyTotal> sorted = totals.stream()
            .sorted((a, b) -> a.week().compareTo(b.week()))
            .toList();
        return sorted.size() > 2 ? sorted.subList(1, sorted.size() - 1) : sorted;
    }

    public DemandForecastResponse.OverallStats stats(List<WeeklyTotal> weeks) {
        if (weeks.isEmpty()) {
            return DemandForecastResponse.OverallStats.builder().seasonality(List.of()).build();
        }
        int n = weeks.size();
        List<WeeklyTotal> recent = weeks.subList(Math.max(0, n - RECENT_WEEKS), n);
        List<WeeklyTotal> previous = weeks.subList(Math.max(0, n - 2 * RECENT_WEEKS), Math.max(0, n - RECENT_WEEKS));

        Double yoy = null;
        if (n > YOY_FROM) {
            yoy = round(averageOrders(weeks.subList(n - YOY_FROM, n - YOY_TO)), 1);
        }

        return DemandForecastResponse.OverallStats.builder()
            .totalOrders(weeks.stream().mapToLong(WeeklyTotal::orders).sum())
            .weeksOfData(n)
            .dateRange(DemandForecastResponse.DateRange.builder()
                .from(weeks.get(0).week())
                .to(weeks.get(n - 1).week())
                .build())
            .recent12wAvg(round(averageOrders(recent), 1))
            .prev12wAvg(round(averageOrders(previous), 1))
            .recentAov(round(averageAov(recent), 0))
            .prevAov(round(averageAov(previous), 0))
            .yoySamePeriodAvg(yoy)
            .seasonality(seasonality(weeks))
            .build();
    }

    public double recentAov(List<WeeklyTotal> weeks) {
        return averageAov(weeks.subList(Math.max(0, weeks.size() - RECENT_WEEKS), weeks.size()));
    }

    public List<DemandForecastResponse.WeekHistory> history(List<WeeklyTotal> weeks) {
        return weeks.subList(Math.max(0, weeks.size() - HISTORY_WEEKS), weeks.size()).stream()
            .map(w -> DemandForecastResponse.WeekHistory.builder()
                .week(w.week())
                .orders(w.orders())
                .revenue(w.revenue() != null ? round(w.revenue(), 0) : 0.0)
                .aov(w.averageOrderValue() != null ? round(w.averageOrderValue(), 0) : 0.0)
                .build())
            .toList();
    }

    // month index = month's mean weekly orders as a percentage of the mean of monthly means
    private List<DemandForecastResponse.SeasonalityIndex> seasonality(List<WeeklyTotal> weeks) {
        Map<Integer, Double> monthly = weeks.stream().collect(Collectors.groupingBy(
            w -> w.week().getMonthValue(), TreeMap::new, Collectors.averagingLong(WeeklyTotal::orders)));
        double overall = monthly.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        List<DemandForecastResponse.SeasonalityIndex> indices = new ArrayList<>(12);
        for (Month month : Month.values()) {
            Double average = monthly.get(month.getValue());
            long index = average != null && overall > 0 ? Math.round(average / overall * 100.0) : 0L;
            indices.add(DemandForecastResponse.SeasonalityIndex.builder()
                .month(month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
                .index(index)
                .build());
        }
        return indices;
    }

    private static double averageOrders(List<WeeklyTotal> weeks) {
        return weeks.stream().mapToLong(WeeklyTotal::orders).average().orElse(0.0);
    }

    private static double averageAov(List<WeeklyTotal> weeks) {
        OptionalDouble average = weeks.stream()
            .map(WeeklyTotal::averageOrderValue)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average();
        return average.orElse(0.0);
    }

    static double round(double value, int decimals) {
        double unit = Math.pow(10, decimals);
        return Math.round(value * unit) / unit;
    }
}
