/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of evaluating one pattern against one component or component pair.
 *
 * <p>Confidence is always within {@code [0, 1]} and {@code matched} is true exactly
 * when the confidence is strictly greater than {@link #MATCH_THRESHOLD}. Use
 * {@link #of(double, Map)} to construct results so the two never disagree.
 */
public record MatchResult(
    @JsonProperty("matched") boolean matched,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("properties") Map<String, Object> properties
) {

    public static final double MATCH_THRESHOLD = 0.5;

    private static final MatchResult NO_MATCH = new MatchResult(false, 0.0, Map.of());

    public MatchResult {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
        if (matched != (confidence > MATCH_THRESHOLD)) {
            throw new IllegalArgumentException(
                "matched=" + matched + " disagrees with confidence " + confidence);
        }
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static MatchResult of(double confidence, Map<String, Object> properties) {
        double clamped = Math.max(0.0, Math.min(1.0, confidence));
        return new MatchResult(clamped > MATCH_THRESHOLD, clamped, properties);
    }

    public static MatchResult noMatch() {
        return NO_MATCH;
    }
}
