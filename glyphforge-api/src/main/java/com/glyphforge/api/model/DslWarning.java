package com.glyphforge.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A non-fatal diagnostic raised while interpreting patterns or applying them.
 *
 * @param line 1-based source line, or 0 when the warning is not tied to source
 */
public record DslWarning(
    @JsonProperty("kind") Kind kind,
    @JsonProperty("message") String message,
    @JsonProperty("line") int line
) {

    public enum Kind {
        /** Soft warning emitted by a {@code scent} directive. */
        SCENT,
        /** A {@code trap} assertion that did not hold. */
        TRAP,
        /** A required pattern matched nothing, or a prohibited one matched. */
        PATTERN
    }

    @Override
    public String toString() {
        return line > 0
            ? kind + " at line " + line + ": " + message
            : kind + ": " + message;
    }
}
