/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.analysis.features;

import com.glyphforge.api.model.BoundingBox;
import com.glyphforge.grid.fill.GridComponent;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns components into numeric feature vectors for classification.
 *
 * <p>Built-in features, in order:
 * <pre>
 *  0 width            bounding-box width in cells
 *  1 height           bounding-box height in cells
 *  2 area             width * height
 *  3 aspect_ratio     width / height
 *  4 border_density   boundary cells / (2 * (width + height))
 *  5 content_density  interior cells / area
 *  6 distinct_chars   number of distinct characters
 *  7 box_char_ratio   box-drawing characters / cells
 *  8 bracket_ratio    bracket characters / cells
 *  9 alpha_ratio      letters and digits / cells
 * 10 underscore_ratio underscores / cells
 * </pre>
 * Contributor features follow in registration order.
 */
public class FeatureExtractor {

    public static final List<String> FEATURE_NAMES = List.of(
        "width", "height", "area", "aspect_ratio", "border_density", "content_density",
        "distinct_chars", "box_char_ratio", "bracket_ratio", "alpha_ratio", "underscore_ratio");

    private static final String BRACKETS = "[](){}<>";

    private final String boxChars;
    private final List<FeatureContributor> contributors;

    public FeatureExtractor(String boxChars) {
        this(boxChars, List.of());
    }

    public FeatureExtractor(String boxChars, List<FeatureContributor> contributors) {
        this.boxChars = boxChars;
        this.contributors = List.copyOf(contributors);
    }

    public FeatureVector extract(GridComponent component) {
        BoundingBox bounds = component.bounds();
        double width = bounds.width();
        double height = bounds.height();
        double area = bounds.area();
        double cells = component.cellCount();

        int alnum = 0;
        for (var entry : component.content().entrySet()) {
            if (Character.isLetterOrDigit(entry.getKey())) {
                alnum += entry.getValue();
            }
        }

        List<double[]> extra = new ArrayList<>(contributors.size());
        int extraLength = 0;
        for (FeatureContributor contributor : contributors) {
            double[] values = contributor.contribute(component);
            extra.add(values);
            extraLength += values.length;
        }

        double[] values = new double[FEATURE_NAMES.size() + extraLength];
        values[0] = width;
        values[1] = height;
        values[2] = area;
        values[3] = width / height;
        values[4] = component.boundaryCount() / (2 * (width + height));
        values[5] = component.interiorCount() / area;
        values[6] = component.content().size();
        values[7] = component.countChars(boxChars) / cells;
        values[8] = component.countChars(BRACKETS) / cells;
        values[9] = alnum / cells;
        values[10] = component.countChars("_") / cells;

        int offset = FEATURE_NAMES.size();
        for (double[] block : extra) {
            System.arraycopy(block, 0, values, offset, block.length);
            offset += block.length;
        }
        return new FeatureVector(values);
    }

    /**
     * Extracts a batch and zero-pads every vector to the batch's longest length.
     */
    public List<FeatureVector> extractAll(List<GridComponent> components) {
        List<FeatureVector> raw = new ArrayList<>(components.size());
        int maxLength = 0;
        for (GridComponent component : components) {
            FeatureVector vector = extract(component);
            raw.add(vector);
            maxLength = Math.max(maxLength, vector.length());
        }
        List<FeatureVector> padded = new ArrayList<>(raw.size());
        for (FeatureVector vector : raw) {
            padded.add(vector.padTo(maxLength));
        }
        return padded;
    }

    /**
     * Stacks vectors into a matrix, zero-padding short rows to {@code width}.
     */
    public static double[][] toMatrix(List<FeatureVector> vectors, int width) {
        double[][] matrix = new double[vectors.size()][];
        for (int i = 0; i < vectors.size(); i++) {
            matrix[i] = vectors.get(i).padTo(width).toArray();
        }
        return matrix;
    }
}
