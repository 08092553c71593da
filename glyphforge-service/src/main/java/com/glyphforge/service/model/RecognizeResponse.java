package com.glyphforge.service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.glyphforge.api.model.DslWarning;

import java.util.List;
import java.util.Map;

/**
 * @param model    component model document (roots, components, warnings)
 * @param warnings pattern compilation and recognition warnings
 * @param code     generated source, absent when the toolkit is {@code none}
 */
public record RecognizeResponse(
    @JsonProperty("model") Map<String, Object> model,
    @JsonProperty("warnings") List<DslWarning> warnings,
    @JsonProperty("toolkit") String toolkit,
    @JsonProperty("code") @JsonInclude(JsonInclude.Include.NON_NULL) String code
) {
}
