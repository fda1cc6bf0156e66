package com.demandplanner.forecast;

import com.demandplanner.domain.Feature;
import com.demandplanner.domain.FeatureRow;
import com.demandplanner.domain.WeeklySeries;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;

@Component
public class FeatureBuilder {

    static final int[] LAGS = {1, 2, 3, 4, 8, 12, 52};
    static final int[] WINDOWS = {4, 8, 12};
    static final int YEAR = 52;

    public List<FeatureRow> build(WeeklySeries series) {
        double[] values = series.values();
        List<FeatureRow> rows = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            rows.add(new FeatureRow(series.weekAt(i), values[i], featuresAt(series.weekAt(i), values, i)));
        }
        return rows;
    }

    public FeatureRow nextRow(WeeklySeries history) {
        if (history.isEmpty()) {
            throw new IllegalArgumentException("Cannot extend an empty series");
        }
        double[] values = history.values();
        int n = values.length;
        LocalDate nextWeek = history.lastWeek().plusWeeks(1);

        double[] features = featuresAt(history.lastWeek(), values, n - 1);
        for (int lag : LAGS) {
            features[Feature.lag(lag).ordinal()] = n - lag >= 0 ? values[n - lag] : Double.NaN;
        }
        applyCalendar(features, nextWeek, n);
        return new FeatureRow(nextWeek, Double.NaN, features);
    }

    public void applyCalendar(double[] features, LocalDate week, int trendIndex) {
        int month = week.getMonthValue();
        features[Feature.WEEK_OF_YEAR.ordinal()] = week.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        features[Feature.MONTH.ordinal()] = month;
        features[Feature.QUARTER.ordinal()] = (month - 1) / 3 + 1;
        features[Feature.TREND.ordinal()] = trendIndex;
    }

    private double[] featuresAt(LocalDate week, double[] values, int i) {
        double[] features = new double[Feature.COUNT];
        for (int lag : LAGS) {
            features[Feature.lag(lag).ordinal()] = i - lag >= 0 ? values[i - lag] : Double.NaN;
        }
        for (int window : WINDOWS) {
            boolean full = i + 1 >= window;
            features[Feature.rollingMean(window).ordinal()] = full ? mean(values, i - window + 1, i) : Double.NaN;
            features[Feature.rollingStd(window).ordinal()] = full ? sampleStd(values, i - window + 1, i) : Double.NaN;
        }
        features[Feature.YOY_CHANGE.ordinal()] = i >= YEAR ? values[i] - values[i - YEAR] : Double.NaN;
        applyCalendar(features, week, i);
        return features;
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i <= to; i++) {
            sum += values[i];
        }
        return sum / (to - from + 1);
    }

    // n - 1 denominator
    private static double sampleStd(double[] values, int from, int to) {
        int n = to - from + 1;
        if (n < 2) {
            return Double.NaN;
        }
        double mean = mean(values, from, to);
        double squares = 0.0;
        for (int i = from; i <= to; i++) {
            double d = values[i] - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / (n - 1));
    }
}
