/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.classification;

import com.glyphforge.analysis.features.FeatureExtractor;
import com.glyphforge.analysis.features.FeatureVector;
import com.glyphforge.api.exceptions.FitException;
import com.glyphforge.grid.Grid;
import com.glyphforge.grid.fill.Connectivity;
import com.glyphforge.grid.fill.GridComponent;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Assigns UI role names (container, button, ...) to components with a decision tree.
 *
 * <p>The tree is trained once at construction and is read-only afterwards, so one
 * instance can be shared between threads.
 */
public class UiRoleClassifier {
    private static final Logger logger = Logger.getLogger(UiRoleClassifier.class.getName());

    private final List<String> labels;
    private final FeatureExtractor extractor;
    private final DecisionTreeClassifier tree;

    private UiRoleClassifier(List<String> labels, FeatureExtractor extractor, DecisionTreeClassifier tree) {
        this.labels = List.copyOf(labels);
        this.extractor = extractor;
        this.tree = tree;
    }

    /**
     * Trains a classifier from labelled ASCII samples.
     *
     * @throws FitException if the set has no samples or a sample has no visible characters
     */
    public static UiRoleClassifier train(TrainingSet trainingSet, FeatureExtractor extractor, int maxDepth) {
        List<GridComponent> components = new ArrayList<>(trainingSet.samples().size());
        int[] y = new int[trainingSet.samples().size()];
        for (int i = 0; i < trainingSet.samples().size(); i++) {
            TrainingSample sample = trainingSet.samples().get(i);
            components.add(sampleComponent(sample));
            y[i] = trainingSet.labelId(sample.label());
        }

        List<FeatureVector> vectors = extractor.extractAll(components);
        int width = vectors.isEmpty() ? 0 : vectors.get(0).length();
        DecisionTreeClassifier tree = new DecisionTreeClassifier(maxDepth);
        tree.fit(FeatureExtractor.toMatrix(vectors, width), y);

        logger.info(String.format("Trained UI role classifier: %d samples, %d labels, depth %d",
            y.length, trainingSet.labels().size(), tree.root().depth()));
        return new UiRoleClassifier(trainingSet.labels(), extractor, tree);
    }

    /**
     * Trains on the bundled default samples.
     */
    public static UiRoleClassifier withDefaults(FeatureExtractor extractor, int maxDepth) {
        return train(TrainingSet.defaults(), extractor, maxDepth);
    }

    public String classify(GridComponent component) {
        return labels.get(tree.predict(extractor.extract(component).toArray()));
    }

    /**
     * Classifies a batch; feature vectors are padded to a common length first.
     */
    public List<String> classifyAll(List<GridComponent> components) {
        List<FeatureVector> vectors = extractor.extractAll(components);
        List<String> roles = new ArrayList<>(vectors.size());
        for (FeatureVector vector : vectors) {
            roles.add(labels.get(tree.predict(vector.toArray())));
        }
        return roles;
    }

    public List<String> labels() {
        return labels;
    }

    public FeatureExtractor extractor() {
        return extractor;
    }

    private static GridComponent sampleComponent(TrainingSample sample) {
        Grid grid = Grid.fromLinesPadded(sample.lines());
        RoaringBitmap region = new RoaringBitmap();
        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                if (!Character.isWhitespace(grid.get(x, y))) {
                    region.add(grid.index(x, y));
                }
            }
        }
        if (region.isEmpty()) {
            throw new FitException("Training sample for '" + sample.label() + "' has no visible characters");
        }
        return GridComponent.of(grid, region, Connectivity.FOUR);
    }
}
