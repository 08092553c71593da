package com.glyphforge.service.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.glyphforge.api.model.CompilationResult;
import com.glyphforge.compiler.analysis.PatternOverlapAnalyzer.PatternOverlap;

import java.util.List;

/**
 * Body returned by {@code POST /patterns/validate}.
 *
 * @param overlaps tag overlaps among the built-in and submitted patterns, most similar first
 */
public record ValidationResponse(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("compilation") CompilationResult compilation,
    @JsonProperty("overlaps") List<PatternOverlap> overlaps
) {
}
