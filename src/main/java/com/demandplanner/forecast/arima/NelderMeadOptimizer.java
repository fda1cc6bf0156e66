package com.demandplanner.forecast.arima;

import java.util.Arrays;
import java.util.Comparator;
import java.util.function.ToDoubleFunction;

/**
 * Derivative-free simplex minimizer with a hard iteration cap.
 */
final class NelderMeadOptimizer {

    private static final double REFLECTION = 1.0;
    private static final double EXPANSION = 2.0;
    private static final double CONTRACTION = 0.5;
    private static final double SHRINK = 0.5;
    private static final double INITIAL_STEP = 0.1;
    private static final double RELATIVE_TOLERANCE = 1e-8;
    private static final double ABSOLUTE_TOLERANCE = 1e-12;

    private final int maxIterations;

    NelderMeadOptimizer(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    record Result(double[] point, double value, int iterations, boolean converged) {}

    Result minimize(ToDoubleFunction<double[]> objective, double[] start) {
        int n = start.length;
        if (n == 0) {
            return new Result(start.clone(), objective.applyAsDouble(start), 0, true);
        }

        Vertex[] simplex = new Vertex[n + 1];
        simplex[0] = vertex(objective, start.clone());
        for (int i = 0; i < n; i++) {
            double[] point = start.clone();
            point[i] += INITIAL_STEP;
            simplex[i + 1] = vertex(objective, point);
        }

        int iteration = 0;
        while (true) {
            Arrays.sort(simplex, Comparator.comparingDouble(Vertex::value));
            Vertex best = simplex[0];
            Vertex worst = simplex[n];
            if (hasConverged(best.value(), worst.value())) {
                return new Result(best.point(), best.value(), iteration, true);
            }
            if (iteration >= maxIterations) {
                return new Result(best.point(), best.value(), iteration, false);
            }
            iteration++;

            double[] centroid = new double[n];
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    centroid[j] += simplex[i].point()[j] / n;
                }
            }

            Vertex reflected = vertex(objective, along(centroid, worst.point(), REFLECTION));
            if (reflected.value() < best.value()) {
                Vertex expanded = vertex(objective, along(centroid, worst.point(), EXPANSION));
                simplex[n] = expanded.value() < reflected.value() ? expanded : reflected;
                continue;
            }
            if (reflected.value() < simplex[n - 1].value()) {
                simplex[n] = reflected;
                continue;
            }

            boolean outside = reflected.value() < worst.value();
            Vertex contracted = outside
                ? vertex(objective, along(centroid, worst.point(), CONTRACTION))
                : vertex(objective, along(centroid, worst.point(), -CONTRACTION));
            if (contracted.value() < Math.min(reflected.value(), worst.value())) {
                simplex[n] = contracted;
                continue;
            }

            for (int i = 1; i <= n; i++) {
                double[] point = new double[n];
                for (int j = 0; j < n; j++) {
                    point[j] = best.point()[j] + SHRINK * (simplex[i].point()[j] - best.point()[j]);
                }
                simplex[i] = vertex(objective, point);
            }
        }
    }

    private static boolean hasConverged(double best, double worst) {
        if (!Double.isFinite(best) || !Double.isFinite(worst)) {
            return false;
        }
        double spread = Math.abs(worst - best);
        return spread <= RELATIVE_TOLERANCE * (Math.abs(best) + Math.abs(worst)) / 2 + ABSOLUTE_TOLERANCE;
    }

    // centroid + coefficient * (centroid - worst)
    private static double[] along(double[] centroid, double[] worst, double coefficient) {
        double[] point = new double[centroid.length];
        for (int j = 0; j < centroid.length; j++) {
            point[j] = centroid[j] + coefficient * (centroid[j] - worst[j]);
        }
        return point;
    }

    private static Vertex vertex(ToDoubleFunction<double[]> objective, double[] point) {
        double value = objective.applyAsDouble(point);
        return new Vertex(point, Double.isNaN(value) ? Double.POSITIVE_INFINITY : value);
    }

    private record Vertex(double[] point, double value) {}
}
