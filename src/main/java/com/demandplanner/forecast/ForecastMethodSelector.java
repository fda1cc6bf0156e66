package com.demandplanner.forecast;

import com.demandplanner.config.PlanningConfig;
import com.demandplanner.domain.ForecastMethod;
import com.demandplanner.domain.ForecastPoint;
import com.demandplanner.domain.SeriesForecast;
import com.demandplanner.domain.WeeklySeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class ForecastMethodSelector {

    private final EnsembleForecaster ensembleForecaster;

    public Optional<SeriesForecast> select(WeeklySeries series, PlanningConfig config,
                                           SeasonalModelConfig seasonalConfig) {
        if (isDormant(series, config)) {
            return Optional.empty();
        }
        if (series.size() >= config.minHistoryWeeksForModel()) {
            EnsembleForecast ensemble = ensembleForecaster.forecast(
                series, config.horizonWeeks(), seasonalConfig, config.recursionStrategy());
            if (!ensemble.isEmpty()) {
                return Optional.of(new SeriesForecast(ensemble.method(), ensemble.points(), ensemble.total()));
            }
            log.debug("Ensemble empty, using trailing average | weeks={}", series.size());
        }
        return Optional.of(trailingAverage(series, config));
    }

    public Optional<SeriesForecast> averageOnly(WeeklySeries series, PlanningConfig config) {
        if (isDormant(series, config)) {
            return Optional.empty();
        }
        return Optional.of(trailingAverage(series, config));
    }

    private static boolean isDormant(WeeklySeries series, PlanningConfig config) {
        return series.isEmpty()
            || series.activeWeeks(config.trailingAverageWeeks()) < config.minActiveWeeks();
    }

    private static SeriesForecast trailingAverage(WeeklySeries series, PlanningConfig config) {
        double average = series.trailingMean(config.trailingAverageWeeks());
        double weekly = Math.round(Math.max(0.0, average) * 10.0) / 10.0;
        List<ForecastPoint> points = new ArrayList<>(config.horizonWeeks());
        for (int step = 1; step <= config.horizonWeeks(); step++) {
            points.add(new ForecastPoint(series.lastWeek().plusWeeks(step), weekly, weekly, weekly));
        }
        return new SeriesForecast(ForecastMethod.AVERAGE_FALLBACK, points,
            Math.max(0.0, average) * config.horizonWeeks());
    }
}
