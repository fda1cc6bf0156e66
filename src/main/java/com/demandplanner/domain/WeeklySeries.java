package com.demandplanner.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

// Contiguous Monday-keyed weeks; gaps between observations are forward-filled.
public final class WeeklySeries {

    private static final WeeklySeries EMPTY = new WeeklySeries(List.of(), new double[0]);

    private final List<LocalDate> weeks;
    private final double[] values;

    private WeeklySeries(List<LocalDate> weeks, double[] values) {
        this.weeks = weeks;
        this.values = values;
    }

    public static WeeklySeries empty() {
        return EMPTY;
    }

    public static WeeklySeries of(Map<LocalDate, ? extends Number> observations) {
        TreeMap<LocalDate, Double> byWeek = new TreeMap<>();
        observations.forEach((date, value) ->
            byWeek.merge(weekStart(date), value != null ? value.doubleValue() : 0.0, Double::sum));
        if (byWeek.isEmpty()) {
            return EMPTY;
        }

        List<LocalDate> weeks = new ArrayList<>();
        List<Double> filled = new ArrayList<>();
        LocalDate cursor = byWeek.firstKey();
        double last = 0.0;
        while (!cursor.isAfter(byWeek.lastKey())) {
            Double observed = byWeek.get(cursor);
            if (observed != null) {
                last = observed;
            }
            weeks.add(cursor);
            filled.add(last);
            cursor = cursor.plusWeeks(1);
        }
        return new WeeklySeries(Collections.unmodifiableList(weeks),
            filled.stream().mapToDouble(Double::doubleValue).toArray());
    }

    public static WeeklySeries starting(LocalDate firstWeek, double... values) {
        LocalDate start = weekStart(firstWeek);
        List<LocalDate> weeks = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            weeks.add(start.plusWeeks(i));
        }
        return new WeeklySeries(Collections.unmodifiableList(weeks), values.clone());
    }

    public static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public List<LocalDate> weeks() {
        return weeks;
    }

    public LocalDate weekAt(int index) {
        return weeks.get(index);
    }

    public double valueAt(int index) {
        return values[index];
    }

    public double[] values() {
        return values.clone();
    }

    public LocalDate lastWeek() {
        if (isEmpty()) {
            throw new IllegalStateException("Empty series has no last week");
        }
        return weeks.get(weeks.size() - 1);
    }

    public double lastValue() {
        if (isEmpty()) {
            throw new IllegalStateException("Empty series has no last value");
        }
        return values[values.length - 1];
    }

    public WeeklySeries append(double value) {
        if (isEmpty()) {
            throw new IllegalStateException("Cannot append to an empty series without a first week");
        }
        List<LocalDate> extendedWeeks = new ArrayList<>(weeks);
        extendedWeeks.add(lastWeek().plusWeeks(1));
        double[] extended = Arrays.copyOf(values, values.length + 1);
        extended[values.length] = value;
        return new WeeklySeries(Collections.unmodifiableList(extendedWeeks), extended);
    }

    public WeeklySeries tail(int n) {
        int from = Math.max(0, values.length - n);
        return new WeeklySeries(weeks.subList(from, values.length),
            Arrays.copyOfRange(values, from, values.length));
    }

    public WeeklySeries trimEnds() {
        if (values.length <= 2) {
            return this;
        }
        return new WeeklySeries(weeks.subList(1, values.length - 1),
            Arrays.copyOfRange(values, 1, values.length - 1));
    }

    public double trailingMean(int n) {
        if (isEmpty()) {
            return 0.0;
        }
        return Arrays.stream(tail(n).values).average().orElse(0.0);
    }

    public int activeWeeks(int n) {
        return (int) Arrays.stream(tail(n).values).filter(v -> v != 0.0).count();
    }

    public double sum() {
        return Arrays.stream(values).sum();
    }

    @Override
    public String toString() {
        return "WeeklySeries[" + values.length + " weeks"
            + (isEmpty() ? "" : ", " + weeks.get(0) + ".." + lastWeek()) + "]";
    }
}
