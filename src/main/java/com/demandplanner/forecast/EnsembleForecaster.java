package com.demandplanner.forecast;

import com.demandplanner.domain.ForecastMethod;
import com.demandplanner.domain.ForecastPoint;
import com.demandplanner.domain.WeeklySeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class EnsembleForecaster {

    static final double SEASONAL_WEIGHT = 0.4;
    static final double TREE_WEIGHT = 0.6;
    static final double FALLBACK_BAND = 0.2;

    private final SeasonalModelAdapter seasonalAdapter;
    private final TreeModelAdapter treeAdapter;

    // steps neither model covers are left out
    public EnsembleForecast forecast(WeeklySeries series, int steps, SeasonalModelConfig seasonalConfig,
                                     RecursionStrategy strategy) {
        if (series.isEmpty() || steps <= 0) {
            return EnsembleForecast.empty();
        }
        ModelForecast seasonal = seasonalAdapter.forecast(series, steps, seasonalConfig);
        ModelForecast tree = treeAdapter.forecast(series, steps, strategy);

        LocalDate lastWeek = series.lastWeek();
        List<ForecastPoint> points = new ArrayList<>(steps);
        for (int step = 0; step < steps; step++) {
            boolean hasSeasonal = step < seasonal.steps();
            boolean hasTree = step < tree.steps();
            double forecast;
            double low;
            double high;
            if (hasSeasonal && hasTree) {
                forecast = SEASONAL_WEIGHT * seasonal.mean(step) + TREE_WEIGHT * tree.mean(step);
                if (seasonal.hasInterval()) {
                    low = seasonal.lower(step);
                    high = seasonal.upper(step);
                } else {
                    low = forecast * (1 - FALLBACK_BAND);
                    high = forecast * (1 + FALLBACK_BAND);
                }
            } else if (hasTree) {
                forecast = tree.mean(step);
                low = forecast * (1 - FALLBACK_BAND);
                high = forecast * (1 + FALLBACK_BAND);
            } else if (hasSeasonal) {
                forecast = seasonal.mean(step);
                low = seasonal.hasInterval() ? seasonal.lower(step) : forecast * (1 - FALLBACK_BAND);
                high = seasonal.hasInterval() ? seasonal.upper(step) : forecast * (1 + FALLBACK_BAND);
            } else {
                continue;
            }
            points.add(point(lastWeek.plusWeeks(step + 1L), forecast, low, high));
        }

        if (points.isEmpty()) {
            log.debug("Ensemble produced no points | weeks={} | seasonal={} | tree={}",
                series.size(), seasonal.reason(), tree.reason());
            return EnsembleForecast.empty();
        }
        return new EnsembleForecast(points, methodOf(seasonal, tree));
    }

    private static ForecastMethod methodOf(ModelForecast seasonal, ModelForecast tree) {
        if (seasonal.isAvailable() && tree.isAvailable()) {
            return ForecastMethod.ENSEMBLE;
        }
        return tree.isAvailable() ? ForecastMethod.TREE : ForecastMethod.SEASONAL;
    }

    // clamp, round, then widen so low <= forecast <= high
    private static ForecastPoint point(LocalDate week, double forecast, double low, double high) {
        double f = round1(Math.max(0.0, forecast));
        double lo = round1(Math.max(0.0, low));
        double hi = round1(Math.max(0.0, high));
        return new ForecastPoint(week, f, Math.min(lo, f), Math.max(hi, f));
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
