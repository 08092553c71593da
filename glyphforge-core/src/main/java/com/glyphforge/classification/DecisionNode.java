package com.glyphforge.classification;

/**
 * Node of a fitted decision tree. A leaf carries a label; a split sends samples with
 * {@code x[featureIndex] <= threshold} left and all others right.
 */
public final class DecisionNode {

    private final int featureIndex;
    private final double threshold;
    private final DecisionNode left;
    private final DecisionNode right;
    private final int label;

    private DecisionNode(int featureIndex, double threshold, DecisionNode left, DecisionNode right, int label) {
        this.featureIndex = featureIndex;
        this.threshold = threshold;
        this.left = left;
        this.right = right;
        this.label = label;
    }

    static DecisionNode leaf(int label) {
        return new DecisionNode(-1, Double.NaN, null, null, label);
    }

    static DecisionNode split(int featureIndex, double threshold, DecisionNode left, DecisionNode right) {
        return new DecisionNode(featureIndex, threshold, left, right, -1);
    }

    public boolean isLeaf() {
        return left == null;
    }

    public int featureIndex() {
        return featureIndex;
    }

    public double threshold() {
        return threshold;
    }

    public DecisionNode left() {
        return left;
    }

    public DecisionNode right() {
        return right;
    }

    public int label() {
        return label;
    }

    public int depth() {
        return isLeaf() ? 0 : 1 + Math.max(left.depth(), right.depth());
    }

    @Override
    public String toString() {
        return isLeaf()
            ? "Leaf(" + label + ")"
            : "Split(x[" + featureIndex + "] <= " + threshold + ", " + left + ", " + right + ")";
    }
}
