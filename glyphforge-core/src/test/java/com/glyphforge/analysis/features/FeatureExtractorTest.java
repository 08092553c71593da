package com.glyphforge.analysis.features;

import com.glyphforge.grid.Grid;
import com.glyphforge.grid.fill.CellPredicate;
import com.glyphforge.grid.fill.FloodFillEngine;
import com.glyphforge.grid.fill.GridComponent;
import com.glyphforge.infra.config.RecognitionConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureExtractorTest {

    private final FloodFillEngine engine = new FloodFillEngine();
    private final FeatureExtractor extractor = new FeatureExtractor(RecognitionConfig.DEFAULT_BOUNDARY_CHARS);

    private GridComponent single(String... lines) {
        Grid grid = Grid.fromLines(List.of(lines));
        return engine.findConnectedComponents(grid, (g, x, y) -> g.get(x, y) != ' ').get(0);
    }

    @Test
    @DisplayName("Should compute features in documented order")
    void testButtonFeatures() {
        FeatureVector vector = extractor.extract(single("[OK]"));

        assertThat(vector.length()).isEqualTo(FeatureExtractor.FEATURE_NAMES.size());
        assertThat(vector.get(0)).isEqualTo(4.0);
        assertThat(vector.get(1)).isEqualTo(1.0);
        assertThat(vector.get(2)).isEqualTo(4.0);
        assertThat(vector.get(3)).isEqualTo(4.0);
        assertThat(vector.get(4)).isCloseTo(0.4, within(1e-9));
        assertThat(vector.get(5)).isEqualTo(0.0);
        assertThat(vector.get(6)).isEqualTo(4.0);
        assertThat(vector.get(7)).isEqualTo(0.0);
        assertThat(vector.get(8)).isEqualTo(0.5);
        assertThat(vector.get(9)).isEqualTo(0.5);
        assertThat(vector.get(10)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should measure box characters on a frame")
    void testFrameFeatures() {
        Grid grid = Grid.fromLines(List.of("+--+", "|  |", "+--+"));
        GridComponent frame = engine.findConnectedComponents(grid, CellPredicate.ofChars("+-|")).get(0);

        FeatureVector vector = extractor.extract(frame);

        assertThat(frame.boundaryCount()).isEqualTo(10);
        assertThat(vector.get(7)).isEqualTo(1.0);
        assertThat(vector.get(4)).isCloseTo(10.0 / 14.0, within(1e-9));
    }

    @Test
    @DisplayName("Should zero-pad contributor features across a batch")
    void testBatchPadding() {
        FeatureExtractor extended = new FeatureExtractor("+-|", List.of(
            component -> component.cellCount() > 3 ? new double[]{7.0, 8.0} : new double[]{9.0}));

        List<FeatureVector> vectors = extended.extractAll(List.of(single("[OK]"), single("ab")));

        int base = FeatureExtractor.FEATURE_NAMES.size();
        assertThat(vectors).allSatisfy(v -> assertThat(v.length()).isEqualTo(base + 2));
        assertThat(vectors.get(0).get(base + 1)).isEqualTo(8.0);
        assertThat(vectors.get(1).get(base)).isEqualTo(9.0);
        assertThat(vectors.get(1).get(base + 1)).isEqualTo(0.0);
    }
}
