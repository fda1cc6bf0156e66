package com.demandplanner.forecast.tree;

import java.util.Arrays;

/**
 * Depth-limited regression tree fitted to residuals with an L2-regularized leaf weight
 * {@code G / (n + lambda)} and the matching split gain.
 */
final class RegressionTree {

    private final Node root;

    private RegressionTree(Node root) {
        this.root = root;
    }

    static RegressionTree fit(double[][] x, double[] residuals, int[] rows, int[] features,
                              int maxDepth, double lambda) {
        return new RegressionTree(grow(x, residuals, rows, features, 0, maxDepth, lambda));
    }

    double predict(double[] features) {
        Node node = root;
        while (!node.isLeaf()) {
            node = features[node.feature] < node.threshold ? node.left : node.right;
        }
        return node.value;
    }

    int depth() {
        return depth(root);
    }

    private static int depth(Node node) {
        return node.isLeaf() ? 0 : 1 + Math.max(depth(node.left), depth(node.right));
    }

    private static Node grow(double[][] x, double[] residuals, int[] rows, int[] features,
                             int depth, int maxDepth, double lambda) {
        double sum = 0.0;
        for (int row : rows) {
            sum += residuals[row];
        }
        double leafValue = sum / (rows.length + lambda);
        if (depth >= maxDepth || rows.length < 2) {
            return Node.leaf(leafValue);
        }

        Split best = findBestSplit(x, residuals, rows, features, sum, lambda);
        if (best == null) {
            return Node.leaf(leafValue);
        }

        int leftCount = 0;
        for (int row : rows) {
            if (x[row][best.feature] < best.threshold) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[rows.length - leftCount];
        int l = 0;
        int r = 0;
        for (int row : rows) {
            if (x[row][best.feature] < best.threshold) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }
        return Node.split(best.feature, best.threshold,
            grow(x, residuals, left, features, depth + 1, maxDepth, lambda),
            grow(x, residuals, right, features, depth + 1, maxDepth, lambda));
    }

    private static Split findBestSplit(double[][] x, double[] residuals, int[] rows, int[] features,
                                       double total, double lambda) {
        double parentScore = total * total / (rows.length + lambda);
        Split best = null;
        double bestGain = 0.0;

        Integer[] order = new Integer[rows.length];
        for (int feature : features) {
            for (int i = 0; i < rows.length; i++) {
                order[i] = rows[i];
            }
            Arrays.sort(order, (a, b) -> Double.compare(x[a][feature], x[b][feature]));

            double leftSum = 0.0;
            for (int i = 0; i < order.length - 1; i++) {
                leftSum += residuals[order[i]];
                double current = x[order[i]][feature];
                double next = x[order[i + 1]][feature];
                if (current == next) {
                    continue;
                }
                int leftCount = i + 1;
                int rightCount = order.length - leftCount;
                double rightSum = total - leftSum;
                double gain = leftSum * leftSum / (leftCount + lambda)
                    + rightSum * rightSum / (rightCount + lambda)
                    - parentScore;
                if (gain > bestGain + 1e-12) {
                    bestGain = gain;
                    best = new Split(feature, (current + next) / 2.0);
                }
            }
        }
        return best;
    }

    private record Split(int feature, double threshold) {}

    private static final class Node {

        private final int feature;
        private final double threshold;
        private final double value;
        private final Node left;
        private final Node right;

        private Node(int feature, double threshold, double value, Node left, Node right) {
            this.feature = feature;
            this.threshold = threshold;
            this.value = value;
            this.left = left;
            this.right = right;
        }

        static Node leaf(double value) {
            return new Node(-1, Double.NaN, value, null, null);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, Double.NaN, left, right);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
