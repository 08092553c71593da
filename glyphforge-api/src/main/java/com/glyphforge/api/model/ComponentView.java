package com.glyphforge.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read-only view of a discovered component, as seen by pattern matchers.
 *
 * @param contentLines bounding-box rows of the component, non-member cells as spaces
 */
public record ComponentView(
    @JsonProperty("id") String id,
    @JsonProperty("bounds") BoundingBox bounds,
    @JsonProperty("content_lines") List<String> contentLines
) {

    public ComponentView {
        contentLines = contentLines == null ? List.of() : List.copyOf(contentLines);
    }

    /** Content lines joined with newlines. */
    public String text() {
        return String.join("\n", contentLines);
    }
}
