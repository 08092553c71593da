package com.glyphforge.service.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of {@code POST /recognize}.
 *
 * @param grid     ASCII art, rows separated by line breaks; short rows are padded
 * @param patterns optional pattern source compiled on top of the built-in library
 * @param toolkit  template set name, {@code none} to skip code generation, null for the default
 * @param options  code generation options such as {@code title} or {@code cell_width}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecognizeRequest(
    @JsonProperty("grid") String grid,
    @JsonProperty("patterns") String patterns,
    @JsonProperty("toolkit") String toolkit,
    @JsonProperty("options") Map<String, String> options
) {

    public RecognizeRequest {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static RecognizeRequest of(String grid) {
        return new RecognizeRequest(grid, null, null, null);
    }
}
