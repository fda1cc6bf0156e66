package com.demandplanner.forecast;

import com.demandplanner.domain.Feature;
import com.demandplanner.domain.FeatureRow;
import com.demandplanner.domain.WeeklySeries;
import com.demandplanner.forecast.tree.GradientBoostedRegressor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class TreeModelAdapter {

    static final int MIN_TRAINING_ROWS = 20;

    private final FeatureBuilder featureBuilder;

    public ModelForecast forecast(WeeklySeries series, int steps, RecursionStrategy strategy) {
        List<FeatureRow> rows = featureBuilder.build(series);
        List<FeatureRow> training = rows.stream().filter(FeatureRow::isComplete).toList();
        if (training.size() < MIN_TRAINING_ROWS) {
            log.debug("Tree model unavailable | weeks={} | completeRows={} | required={}",
                series.size(), training.size(), MIN_TRAINING_ROWS);
            return ModelForecast.unavailable("insufficient complete feature rows: " + training.size());
        }

        double[][] x = new double[training.size()][];
        double[] y = new double[training.size()];
        for (int i = 0; i < training.size(); i++) {
            x[i] = training.get(i).vector();
            y[i] = training.get(i).target();
        }

        try {
            GradientBoostedRegressor model = GradientBoostedRegressor.fit(x, y, GradientBoostedRegressor.Params.DEFAULT);
            double[] predictions = strategy == RecursionStrategy.RECOMPUTE
                ? recompute(model, series, steps)
                : carryForward(model, rows.get(rows.size() - 1), steps);
            return ModelForecast.of(predictions);
        } catch (ModelFitException ex) {
            log.debug("Tree model unavailable | weeks={} | reason={}", series.size(), ex.getMessage());
            return ModelForecast.unavailable(ex.getMessage());
        }
    }

    private double[] carryForward(GradientBoostedRegressor model, FeatureRow last, int steps) {
        double[] features = last.vector();
        LocalDate week = last.weekStart();
        int trend = (int) last.get(Feature.TREND);
        double previous = last.target();

        double[] predictions = new double[steps];
        for (int step = 0; step < steps; step++) {
            week = week.plusWeeks(1);
            trend++;
            featureBuilder.applyCalendar(features, week, trend);
            features[Feature.LAG_1.ordinal()] = previous;
            double prediction = Math.max(0.0, model.predict(missingAsZero(features)));
            predictions[step] = prediction;
            previous = prediction;
        }
        return predictions;
    }

    private double[] recompute(GradientBoostedRegressor model, WeeklySeries series, int steps) {
        WeeklySeries extended = series;
        double[] predictions = new double[steps];
        for (int step = 0; step < steps; step++) {
            FeatureRow next = featureBuilder.nextRow(extended);
            double prediction = Math.max(0.0, model.predict(missingAsZero(next.vector())));
            predictions[step] = prediction;
            extended = extended.append(prediction);
        }
        return predictions;
    }

    private static double[] missingAsZero(double[] features) {
        double[] filled = features.clone();
        for (int i = 0; i < filled.length; i++) {
            if (Double.isNaN(filled[i])) {
                filled[i] = 0.0;
            }
        }
        return filled;
    }
}
