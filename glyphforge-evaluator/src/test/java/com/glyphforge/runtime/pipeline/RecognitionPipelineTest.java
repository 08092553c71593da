package com.glyphforge.runtime.pipeline;

import com.glyphforge.analysis.features.FeatureExtractor;
import com.glyphforge.api.WarningSink;
import com.glyphforge.api.model.BoundingBox;
import com.glyphforge.api.model.DslWarning;
import com.glyphforge.classification.UiRoleClassifier;
import com.glyphforge.compiler.PatternCompiler;
import com.glyphforge.compiler.library.BuiltInPatterns;
import com.glyphforge.compiler.registry.PatternRegistry;
import com.glyphforge.grid.Grid;
import com.glyphforge.infra.config.RecognitionConfig;
import com.glyphforge.infra.metrics.MetricsRegistry;
import com.glyphforge.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.glyphforge.infra.telemetry.TracingService;
import com.glyphforge.model.AbstractComponent;
import com.glyphforge.model.ComponentModel;
import com.glyphforge.model.SpatialRelationshipAnalyzer;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RecognitionPipelineTest {

    private static final List<String> BOXED_BUTTON = List.of(
        "+----+",
        "|[OK]|",
        "+----+");

    private static UiRoleClassifier classifier;

    private PatternRegistry registry;
    private InMemoryMetricsRegistry metrics;
    private WarningSink sink;

    @BeforeAll
    static void trainClassifier() {
        classifier = UiRoleClassifier.withDefaults(
            new FeatureExtractor(RecognitionConfig.DEFAULT_BOUNDARY_CHARS), 5);
    }

    @BeforeEach
    void setUp() {
        registry = new PatternRegistry();
        metrics = new InMemoryMetricsRegistry();
        sink = mock(WarningSink.class);
    }

    private RecognitionPipeline pipeline(RecognitionConfig config) {
        return new RecognitionPipeline(config, registry, classifier, TracingService.noopTracer(), metrics, sink);
    }

    private void compile(String source) {
        new PatternCompiler(registry).compile(source, "test");
    }

    @Test
    @DisplayName("Should recognize a boxed button end to end")
    void testBoxedButton() {
        compile("<Track:button [INIT {tag:button = (val \"[\", \"]\")}]>");

        RecognitionResult result = pipeline(RecognitionConfig.defaults()).recognize(Grid.fromLines(BOXED_BUTTON));

        assertThat(result.components()).hasSize(2);
        assertThat(result.components().get(0).bounds()).isEqualTo(new BoundingBox(0, 0, 5, 2));
        assertThat(result.components().get(1).bounds()).isEqualTo(new BoundingBox(1, 1, 4, 1));
        assertThat(result.containment().hasEdge(0, 1)).isTrue();
        assertThat(result.containment().reducedEdges()).hasSize(1);
        assertThat(result.containment().reducedEdges().get(0).score()).isCloseTo(4.0 / 18.0, within(1e-9));

        ComponentModel model = result.model();
        AbstractComponent button = model.get("c1");
        assertThat(button.getUiRole()).isEqualTo("button");
        assertThat(button.getProperty("confidence")).isEqualTo(1.0);
        assertThat(button.getProperty("pattern")).isEqualTo("button");
        assertThat(button.getProperty("has_button")).isEqualTo(true);
        assertThat(button.getProperty("text")).isEqualTo("OK");
        assertThat(button.getParentId()).isEqualTo("c0");
        assertThat(model.get("c0").hasRelationship(SpatialRelationshipAnalyzer.CONTAINS, "c1")).isTrue();
        assertThat(model.get("c0").getProperty("text")).isNull();
        assertThat(result.matchesFor("c0")).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("Should record pipeline metrics")
    void testMetrics() {
        compile("<Track:button [INIT {tag:button = (val \"[\", \"]\")}]>");

        pipeline(RecognitionConfig.defaults()).recognize(Grid.fromLines(BOXED_BUTTON));

        assertThat(metrics.counter(MetricsRegistry.GRIDS_PROCESSED).count()).isEqualTo(1);
        assertThat(metrics.counter(MetricsRegistry.COMPONENTS_DISCOVERED).count()).isEqualTo(2);
        assertThat(metrics.counter(MetricsRegistry.PATTERN_MATCHES).count()).isEqualTo(1);
        assertThat(metrics.timer(MetricsRegistry.RECOGNITION_LATENCY).count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject grids above the configured size before flood fill")
    void testOversizedGrid() {
        RecognitionConfig config = RecognitionConfig.builder().maxGridCells(10).build();

        assertThatThrownBy(() -> pipeline(config).recognize(Grid.fromLines(BOXED_BUTTON)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("exceeds the maximum of 10 cells");
        assertThat(metrics.counter(MetricsRegistry.GRIDS_PROCESSED).count()).isZero();
    }

    @Test
    @DisplayName("Should join words across single spaces only when enabled")
    void testWordGaps() {
        BuiltInPatterns.registerInto(registry);
        Grid grid = Grid.fromLines(List.of("Name: ____"));

        RecognitionResult merged = pipeline(RecognitionConfig.defaults()).recognize(grid);
        RecognitionResult split = pipeline(RecognitionConfig.builder().mergeWordGaps(false).build()).recognize(grid);

        assertThat(merged.components()).hasSize(1);
        AbstractComponent field = merged.model().get("c0");
        assertThat(field.getUiRole()).isEqualTo("text_field");
        assertThat(field.getProperty("field_text")).isEqualTo("Name");
        assertThat(field.getProperty("text")).isEqualTo("Name: ____");
        assertThat(split.components()).hasSize(2);
    }

    @Test
    @DisplayName("Should warn about required and prohibited patterns")
    void testPatternWarnings() {
        compile("<Track:button [INIT {tag:button = (val \"[\", \"]\")}]>\n"
            + "<Track:must [INIT {tag:star = (val \"*\")}]> EXEC:req\n"
            + "<Track:banned [INIT {tag:ok = (val \"OK\")}]> EXEC:prohib");

        RecognitionResult result = pipeline(RecognitionConfig.defaults()).recognize(Grid.fromLines(BOXED_BUTTON));

        DslWarning prohibited = new DslWarning(DslWarning.Kind.PATTERN,
            "Prohibited pattern 'banned' matched component c1", 0);
        DslWarning required = new DslWarning(DslWarning.Kind.PATTERN,
            "Required pattern 'must' matched no component", 0);
        assertThat(result.warnings()).containsExactly(prohibited, required);
        assertThat(result.model().get("c1").getProperty("pattern")).isEqualTo("button");
        verify(sink).warn(prohibited);
        verify(sink).warn(required);
    }

    @Test
    @DisplayName("Should add spatial and pattern relationships between siblings")
    void testRelationships() {
        compile("<RACK:pair [INIT {tag:next_to = (val \"[\")}]>");
        Grid grid = Grid.fromLines(List.of(
            "+----------+",
            "|[OK]  [No]|",
            "+----------+"));

        ComponentModel model = pipeline(RecognitionConfig.defaults()).recognize(grid).model();

        assertThat(model.children("c0")).extracting(AbstractComponent::getId).containsExactly("c1", "c2");
        assertThat(model.get("c1").hasRelationship(SpatialRelationshipAnalyzer.LEFT_OF, "c2")).isTrue();
        assertThat(model.get("c2").hasRelationship(SpatialRelationshipAnalyzer.RIGHT_OF, "c1")).isTrue();
        assertThat(model.get("c1").hasRelationship("next_to", "c2")).isTrue();
        assertThat(model.get("c2").hasRelationship("next_to", "c1")).isTrue();
        assertThat(model.get("c0").hasRelationship("next_to", "c1")).isFalse();
    }

    @Test
    @DisplayName("Should keep nested frames in a containment chain")
    void testNestedFrames() {
        Grid grid = Grid.fromLines(List.of(
            "+----------+",
            "|          |",
            "|  +----+  |",
            "|  | Hi |  |",
            "|  +----+  |",
            "|          |",
            "+----------+"));

        RecognitionResult result = pipeline(RecognitionConfig.defaults()).recognize(grid);

        ComponentModel model = result.model();
        assertThat(model.size()).isEqualTo(3);
        assertThat(model.roots()).extracting(AbstractComponent::getId).containsExactly("c0");
        assertThat(model.get("c2").getParentId()).isEqualTo("c1");
        assertThat(model.get("c1").getParentId()).isEqualTo("c0");
        assertThat(result.containment().hasEdge(0, 2)).isFalse();
        assertThat(model.depthFirst()).extracting(AbstractComponent::getId).containsExactly("c0", "c1", "c2");
    }
}
