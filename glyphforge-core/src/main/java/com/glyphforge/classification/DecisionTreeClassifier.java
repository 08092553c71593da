/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.classification;

import com.glyphforge.api.exceptions.FitException;

import java.util.Arrays;
import java.util.logging.Logger;

/**
 * Entropy-based binary decision tree over integer labels.
 *
 * <p>Growth is fully deterministic: features are tried in ascending index order and,
 * within a feature, candidate thresholds are the distinct sample values in ascending
 * order. A candidate replaces the current best only when its information gain is strictly
 * greater, so ties keep the earliest candidate. Splits that leave one side empty are
 * never taken. A node becomes a leaf when it is pure, when {@code maxDepth} is reached or
 * when no usable split exists; its label is the most frequent one, ties going to the
 * smallest label.
 *
 * <p>Fitting twice on the same data yields identical predictions.
 */
public class DecisionTreeClassifier {
    private static final Logger logger = Logger.getLogger(DecisionTreeClassifier.class.getName());

    private final int maxDepth;
    private DecisionNode root;
    private int featureCount;
    private int labelCount;

    public DecisionTreeClassifier(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be non-negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Trains the tree, replacing any previous fit.
     *
     * @param x samples, one row per sample, all rows the same length
     * @param y non-negative labels, one per sample
     * @throws FitException if the data is empty or inconsistent
     */
    public void fit(double[][] x, int[] y) {
        if (x == null || y == null || x.length == 0) {
            throw new FitException("Cannot fit on an empty training set");
        }
        if (x.length != y.length) {
            throw new FitException(String.format(
                "Sample count %d does not match label count %d", x.length, y.length));
        }
        int width = x[0].length;
        int maxLabel = 0;
        for (int i = 0; i < x.length; i++) {
            if (x[i].length != width) {
                throw new FitException(String.format(
                    "Sample %d has %d features, expected %d", i, x[i].length, width));
            }
            if (y[i] < 0) {
                throw new FitException("Labels must be non-negative, got " + y[i] + " at sample " + i);
            }
            maxLabel = Math.max(maxLabel, y[i]);
        }

        this.featureCount = width;
        this.labelCount = maxLabel + 1;
        int[] all = new int[x.length];
        for (int i = 0; i < all.length; i++) {
            all[i] = i;
        }
        this.root = grow(x, y, all, 0);
        logger.fine(() -> String.format("Fitted decision tree on %d samples, %d features, depth %d",
            x.length, width, root.depth()));
    }

    /**
     * Predicts a label. Vectors shorter than the training width are zero-padded.
     *
     * @throws FitException if called before {@link #fit}
     */
    public int predict(double[] sample) {
        if (root == null) {
            throw new FitException("Classifier has not been fitted");
        }
        DecisionNode node = root;
        while (!node.isLeaf()) {
            int f = node.featureIndex();
            double value = f < sample.length ? sample[f] : 0.0;
            node = value <= node.threshold() ? node.left() : node.right();
        }
        return node.label();
    }

    public int[] predict(double[][] samples) {
        int[] labels = new int[samples.length];
        for (int i = 0; i < samples.length; i++) {
            labels[i] = predict(samples[i]);
        }
        return labels;
    }

    public boolean isFitted() {
        return root != null;
    }

    public DecisionNode root() {
        return root;
    }

    public int featureCount() {
        return featureCount;
    }

    public int maxDepth() {
        return maxDepth;
    }

    private DecisionNode grow(double[][] x, int[] y, int[] indices, int depth) {
        int[] counts = labelCounts(y, indices);
        if (depth >= maxDepth || isPure(counts)) {
            return DecisionNode.leaf(majority(counts));
        }

        double parentEntropy = entropy(counts, indices.length);
        double bestGain = -1.0;
        int bestFeature = -1;
        double bestThreshold = 0.0;

        for (int f = 0; f < featureCount; f++) {
            for (double threshold : distinctValues(x, indices, f)) {
                int[] leftCounts = new int[labelCount];
                int[] rightCounts = new int[labelCount];
                int leftSize = 0;
                for (int i : indices) {
                    if (x[i][f] <= threshold) {
                        leftCounts[y[i]]++;
                        leftSize++;
                    } else {
                        rightCounts[y[i]]++;
                    }
                }
                int rightSize = indices.length - leftSize;
                if (leftSize == 0 || rightSize == 0) {
                    continue;
                }
                double n = indices.length;
                double gain = parentEntropy
                    - (leftSize / n) * entropy(leftCounts, leftSize)
                    - (rightSize / n) * entropy(rightCounts, rightSize);
                if (gain > bestGain) {
                    bestGain = gain;
                    bestFeature = f;
                    bestThreshold = threshold;
                }
            }
        }

        if (bestFeature < 0) {
            return DecisionNode.leaf(majority(counts));
        }

        int leftSize = 0;
        for (int i : indices) {
            if (x[i][bestFeature] <= bestThreshold) {
                leftSize++;
            }
        }
        int[] left = new int[leftSize];
        int[] right = new int[indices.length - leftSize];
        int li = 0;
        int ri = 0;
        for (int i : indices) {
            if (x[i][bestFeature] <= bestThreshold) {
                left[li++] = i;
            } else {
                right[ri++] = i;
            }
        }
        return DecisionNode.split(bestFeature, bestThreshold,
            grow(x, y, left, depth + 1),
            grow(x, y, right, depth + 1));
    }

    private int[] labelCounts(int[] y, int[] indices) {
        int[] counts = new int[labelCount];
        for (int i : indices) {
            counts[y[i]]++;
        }
        return counts;
    }

    private static boolean isPure(int[] counts) {
        int nonZero = 0;
        for (int c : counts) {
            if (c > 0) {
                nonZero++;
            }
        }
        return nonZero <= 1;
    }

    private static int majority(int[] counts) {
        int best = 0;
        for (int label = 1; label < counts.length; label++) {
            if (counts[label] > counts[best]) {
                best = label;
            }
        }
        return best;
    }

    private static double entropy(int[] counts, int total) {
        double h = 0.0;
        for (int c : counts) {
            if (c > 0) {
                double p = (double) c / total;
                h -= p * (Math.log(p) / Math.log(2));
            }
        }
        return h;
    }

    private static double[] distinctValues(double[][] x, int[] indices, int feature) {
        double[] values = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            values[i] = x[indices[i]][feature];
        }
        return Arrays.stream(values).sorted().distinct().toArray();
    }
}
