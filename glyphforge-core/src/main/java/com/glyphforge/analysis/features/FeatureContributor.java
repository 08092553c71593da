package com.glyphforge.analysis.features;

import com.glyphforge.grid.fill.GridComponent;

/**
 * Supplies extra features appended after the built-in ones. Contributors may return
 * vectors of different lengths; batches are zero-padded to the longest.
 */
@FunctionalInterface
public interface FeatureContributor {

    double[] contribute(GridComponent component);
}
