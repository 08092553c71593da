package com.glyphforge.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of compiling one pattern source.
 *
 * @param patternIds ids registered by this source, in registration order
 * @param error      failure message when the source was rejected, otherwise null
 */
public record CompilationResult(
    @JsonProperty("source") String sourceName,
    @JsonProperty("pattern_ids") List<String> patternIds,
    @JsonProperty("warnings") List<DslWarning> warnings,
    @JsonProperty("error") String error,
    @JsonProperty("duration_nanos") long durationNanos
) {

    public CompilationResult {
        patternIds = patternIds == null ? List.of() : List.copyOf(patternIds);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean succeeded() {
        return error == null;
    }
}
