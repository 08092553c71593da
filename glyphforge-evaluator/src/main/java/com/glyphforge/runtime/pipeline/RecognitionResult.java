package com.glyphforge.runtime.pipeline;

import com.glyphforge.analysis.containment.ContainmentGraph;
import com.glyphforge.api.model.DslWarning;
import com.glyphforge.api.model.PatternMatch;
import com.glyphforge.grid.fill.GridComponent;
import com.glyphforge.model.ComponentModel;

import java.util.List;
import java.util.Map;

/**
 * Everything one recognition run produced.
 *
 * @param model       the component graph, ids {@code c0..c(n-1)}
 * @param components  discovered regions, index {@code i} is component {@code c<i>}
 * @param containment the containment forest over {@code components}
 * @param matches     pattern matches per component id, best first; ids without matches
 *                    are absent
 * @param warnings    PATTERN warnings raised by required and prohibited patterns
 */
public record RecognitionResult(
    ComponentModel model,
    List<GridComponent> components,
    ContainmentGraph containment,
    Map<String, List<PatternMatch>> matches,
    List<DslWarning> warnings
) {

    public RecognitionResult {
        components = List.copyOf(components);
        matches = Map.copyOf(matches);
        warnings = List.copyOf(warnings);
    }

    public List<PatternMatch> matchesFor(String componentId) {
        return matches.getOrDefault(componentId, List.of());
    }
}
