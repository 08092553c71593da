package com.glyphforge.service;

import com.glyphforge.api.exceptions.ParseException;
import com.glyphforge.api.model.DslWarning;
import com.glyphforge.compiler.analysis.PatternOverlapAnalyzer.PatternOverlap;
import com.glyphforge.infra.config.RecognitionConfig;
import com.glyphforge.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.glyphforge.infra.telemetry.TracingService;
import com.glyphforge.service.model.RecognizeRequest;
import com.glyphforge.service.model.RecognizeResponse;
import com.glyphforge.service.model.ValidationResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecognitionServiceTest {

    static final String BOXED_BUTTON = "+----+\n|[OK]|\n+----+\n";
    static final String OK_PATTERN =
        "<Track:ok_button [INIT {tag:ok = (val \"OK\")}]>\n<hunt [scent = \"careful\"]>";

    private InMemoryMetricsRegistry metrics;
    private RecognitionService service;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        service = new RecognitionService(RecognitionConfig.defaults(), TracingService.noopTracer(), metrics);
    }

    @Test
    @DisplayName("Should recognize a grid with the built-in patterns and generate tkinter code")
    void testRecognizeDefaults() {
        RecognizeResponse response = service.recognize(RecognizeRequest.of(BOXED_BUTTON));

        assertThat(response.toolkit()).isEqualTo("tkinter");
        assertThat(response.model()).containsEntry("roots", List.of("c0"));
        assertThat(response.code())
            .startsWith("import tkinter as tk")
            .contains("self.button_c1 = tk.Button(")
            .contains("text='OK'");
        assertThat(response.warnings()).isEmpty();
        assertThat(metrics.snapshot()).containsEntry("grids_processed", 1L);
    }

    @Test
    @DisplayName("Should skip code generation for the none toolkit and honour options")
    void testToolkitSelection() {
        assertThat(service.recognize(new RecognizeRequest(BOXED_BUTTON, null, "none", null)).code()).isNull();

        RecognizeResponse swing = service.recognize(
            new RecognizeRequest(BOXED_BUTTON, null, "swing", Map.of("class_name", "Dialog")));
        assertThat(swing.code()).contains("public class Dialog extends JFrame {").contains("JButton button_c1");
    }

    @Test
    @DisplayName("Should reject requests without a grid or with an unknown toolkit")
    void testInvalidRequests() {
        assertThatThrownBy(() -> service.recognize(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("grid is required");
        assertThatThrownBy(() -> service.recognize(new RecognizeRequest(BOXED_BUTTON, null, "qt", null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("qt");
        assertThatThrownBy(() -> service.recognize(new RecognizeRequest(BOXED_BUTTON, "<hunt", null, null)))
            .isInstanceOf(ParseException.class);
    }

    @Test
    @DisplayName("Should keep submitted patterns and their warnings scoped to one request")
    void testRequestPatternsIsolated() {
        RecognizeRequest request = new RecognizeRequest(BOXED_BUTTON, OK_PATTERN, "none", null);

        RecognizeResponse first = service.recognize(request);
        RecognizeResponse second = service.recognize(request);

        assertThat(first.warnings()).extracting(DslWarning::kind).containsExactly(DslWarning.Kind.SCENT);
        assertThat(second.warnings()).extracting(DslWarning::message).containsExactly("careful");
        assertThat(service.recognize(RecognizeRequest.of(BOXED_BUTTON)).warnings()).isEmpty();
    }

    @Test
    @DisplayName("Should validate pattern sources and report overlaps with the library")
    void testValidate() {
        ValidationResponse ok = service.validate(OK_PATTERN);
        assertThat(ok.valid()).isTrue();
        assertThat(ok.compilation().patternIds()).containsExactly("ok_button");
        assertThat(ok.overlaps()).isEmpty();

        ValidationResponse brackets = service.validate("<Track:brackets [INIT {tag:pair = (val \"[\", \"]\")}]>");
        assertThat(brackets.overlaps()).extracting(PatternOverlap::similarity).first().isEqualTo(1.0);

        ValidationResponse broken = service.validate("<hunt");
        assertThat(broken.valid()).isFalse();
        assertThat(broken.compilation().error()).contains("Expected");
        assertThat(broken.overlaps()).isEmpty();
    }

    @Test
    @DisplayName("Should reject an oversized grid before padding it or compiling patterns")
    void testOversizedGrid() {
        RecognitionService small = new RecognitionService(
            RecognitionConfig.builder().maxGridCells(10).build(), TracingService.noopTracer(), metrics);

        assertThatThrownBy(() -> small.recognize(new RecognizeRequest(BOXED_BUTTON, "<hunt", null, null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Grid of 6x3 cells exceeds the maximum of 10 cells");
        assertThat(metrics.snapshot()).doesNotContainEntry("grids_processed", 1L);
    }
}
