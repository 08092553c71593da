/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.compiler.analysis;

import com.glyphforge.api.model.PatternDefinition;
import com.glyphforge.compiler.registry.PatternRegistry;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds component patterns whose tag literals overlap.
 *
 * <p>Two patterns overlap when the Jaccard similarity of their tag literal sets,
 * {@code |A ∩ B| / |A ∪ B|}, is at least the threshold. Overlapping patterns can match
 * the same component, in which case registration order decides the winner among equal
 * confidences.
 *
 * <h2>Usage</h2>
 * <pre>
 * OverlapReport report = new PatternOverlapAnalyzer().analyze(registry);
 * report.sortedBySimilarity().forEach(o -> System.out.println(o.describe()));
 * </pre>
 *
 * <p>Pairwise, O(N²) in the number of component patterns.
 */
public class PatternOverlapAnalyzer {

    private static final double DEFAULT_OVERLAP_THRESHOLD = 0.5;

    private final double threshold;

    public PatternOverlapAnalyzer() {
        this(DEFAULT_OVERLAP_THRESHOLD);
    }

    /**
     * @param threshold minimum Jaccard similarity to report (0.0-1.0)
     */
    public PatternOverlapAnalyzer(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException(
                "Overlap threshold must be between 0.0 and 1.0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    public OverlapReport analyze(PatternRegistry registry) {
        return analyze(registry.componentPatterns());
    }

    public OverlapReport analyze(List<PatternDefinition> patterns) {
        List<PatternOverlap> overlaps = new ArrayList<>();
        for (int i = 0; i < patterns.size(); i++) {
            for (int j = i + 1; j < patterns.size(); j++) {
                PatternOverlap overlap = checkOverlap(patterns.get(i), patterns.get(j));
                if (overlap != null) {
                    overlaps.add(overlap);
                }
            }
        }
        return new OverlapReport(overlaps, threshold);
    }

    private PatternOverlap checkOverlap(PatternDefinition first, PatternDefinition second) {
        Set<String> a = first.tagLiterals();
        Set<String> b = second.tagLiterals();

        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);

        double similarity = union.isEmpty() ? 0.0 : (double) intersection.size() / union.size();
        if (union.isEmpty() || similarity < threshold) {
            return null;
        }
        return new PatternOverlap(
            first.id(), second.id(), similarity,
            intersection.size(), a.size() - intersection.size(), b.size() - intersection.size());
    }

    /**
     * @param overlaps  pairs at or above the threshold, in registration order
     * @param threshold the similarity threshold used
     */
    public record OverlapReport(List<PatternOverlap> overlaps, double threshold) implements Serializable {

        public OverlapReport {
            overlaps = List.copyOf(overlaps);
        }

        public boolean hasOverlaps() {
            return !overlaps.isEmpty();
        }

        public int overlapCount() {
            return overlaps.size();
        }

        public List<PatternOverlap> sortedBySimilarity() {
            return overlaps.stream()
                .sorted((x, y) -> Double.compare(y.similarity(), x.similarity()))
                .toList();
        }
    }

    public record PatternOverlap(
        String firstId,
        String secondId,
        double similarity,
        int sharedLiterals,
        int uniqueToFirst,
        int uniqueToSecond
    ) implements Serializable {

        public String describe() {
            return String.format("Patterns '%s' and '%s' overlap by %.1f%% (%d shared, %d + %d unique)",
                firstId, secondId, similarity * 100, sharedLiterals, uniqueToFirst, uniqueToSecond);
        }
    }
}
