package com.glyphforge.analysis.features;

import java.util.Arrays;

/**
 * Fixed-order numeric feature vector of one component.
 */
public final class FeatureVector {

    private final double[] values;

    public FeatureVector(double[] values) {
        this.values = values.clone();
    }

    public double get(int index) {
        return values[index];
    }

    public int length() {
        return values.length;
    }

    public double[] toArray() {
        return values.clone();
    }

    /**
     * Returns a copy right-padded with zeros to {@code length}. Never truncates.
     */
    public FeatureVector padTo(int length) {
        if (length <= values.length) {
            return this;
        }
        return new FeatureVector(Arrays.copyOf(values, length));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FeatureVector other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
