package com.demandplanner.forecast.tree;

import com.demandplanner.forecast.ModelFitException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Squared-error gradient boosting over {@link RegressionTree}s with row and column
 * subsampling per tree. Fits are deterministic for a given seed.
 */
public final class GradientBoostedRegressor {

    public record Params(int trees, int maxDepth, double learningRate, double subsample,
                         double columnSample, double lambda, long seed) {

        public static final Params DEFAULT = new Params(200, 4, 0.05, 0.8, 0.8, 1.0, 42L);
    }

    private final double baseScore;
    private final double learningRate;
    private final List<RegressionTree> trees;

    private GradientBoostedRegressor(double baseScore, double learningRate, List<RegressionTree> trees) {
        this.baseScore = baseScore;
        this.learningRate = learningRate;
        this.trees = trees;
    }

    public static GradientBoostedRegressor fit(double[][] x, double[] y, Params params) {
        if (x.length == 0 || x.length != y.length) {
            throw new ModelFitException("training set is empty or misaligned");
        }
        for (double target : y) {
            if (!Double.isFinite(target)) {
                throw new ModelFitException("training target contains non-finite values");
            }
        }

        int rows = x.length;
        int columns = x[0].length;
        Random random = new Random(params.seed());
        double baseScore = IntStream.range(0, rows).mapToDouble(i -> y[i]).average().orElse(0.0);

        double[] predictions = new double[rows];
        Arrays.fill(predictions, baseScore);
        double[] residuals = new double[rows];
        int sampledRows = Math.max(1, (int) Math.round(rows * params.subsample()));
        int sampledColumns = Math.max(1, (int) Math.round(columns * params.columnSample()));

        List<RegressionTree> trees = new ArrayList<>(params.trees());
        for (int t = 0; t < params.trees(); t++) {
            for (int i = 0; i < rows; i++) {
                residuals[i] = y[i] - predictions[i];
            }
            int[] rowSample = sample(rows, sampledRows, random);
            int[] columnSample = sample(columns, sampledColumns, random);
            RegressionTree tree = RegressionTree.fit(x, residuals, rowSample, columnSample,
                params.maxDepth(), params.lambda());
            trees.add(tree);
            for (int i = 0; i < rows; i++) {
                predictions[i] += params.learningRate() * tree.predict(x[i]);
            }
        }
        return new GradientBoostedRegressor(baseScore, params.learningRate(), Collections.unmodifiableList(trees));
    }

    public double predict(double[] features) {
        double prediction = baseScore;
        for (RegressionTree tree : trees) {
            prediction += learningRate * tree.predict(features);
        }
        return prediction;
    }

    public int treeCount() {
        return trees.size();
    }

    public double baseScore() {
        return baseScore;
    }

    // sorted sample without replacement
    private static int[] sample(int population, int size, Random random) {
        List<Integer> indices = new ArrayList<>(population);
        for (int i = 0; i < population; i++) {
            indices.add(i);
        }
        Collections.shuffle(indices, random);
        return indices.subList(0, Math.min(size, population)).stream()
            .mapToInt(Integer::intValue)
            .sorted()
            .toArray();
    }
}
