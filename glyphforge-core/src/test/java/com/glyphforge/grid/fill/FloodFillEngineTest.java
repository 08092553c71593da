package com.glyphforge.grid.fill;

import com.glyphforge.api.model.BoundingBox;
import com.glyphforge.grid.Grid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class FloodFillEngineTest {

    private final FloodFillEngine engine = new FloodFillEngine();

    private static Grid randomGrid(long seed, int width, int height, String alphabet) {
        Random random = new Random(seed);
        Grid grid = new Grid(width, height, ' ');
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                grid.set(x, y, alphabet.charAt(random.nextInt(alphabet.length())));
            }
        }
        return grid;
    }

    @Test
    @DisplayName("Should partition exactly the target cells into disjoint connected regions")
    void testComponentsPartitionTargetCells() {
        for (long seed = 0; seed < 25; seed++) {
            Grid grid = randomGrid(seed, 17, 11, "#. ");
            for (Connectivity connectivity : Connectivity.values()) {
                FloodFillEngine fill = new FloodFillEngine(connectivity);
                List<GridComponent> components = fill.findConnectedComponents(grid, '#');

                RoaringBitmap expected = new RoaringBitmap();
                for (int y = 0; y < grid.height(); y++) {
                    for (int x = 0; x < grid.width(); x++) {
                        if (grid.get(x, y) == '#') {
                            expected.add(grid.index(x, y));
                        }
                    }
                }

                RoaringBitmap union = new RoaringBitmap();
                int total = 0;
                for (GridComponent component : components) {
                    RoaringBitmap cells = component.cellIndices();
                    assertThat(RoaringBitmap.and(union, cells).isEmpty()).isTrue();
                    union.or(cells);
                    total += cells.getCardinality();

                    int first = cells.first();
                    RoaringBitmap refilled = fill.fillRegion(grid, grid.xOf(first), grid.yOf(first), '#');
                    assertThat(refilled).isEqualTo(cells);
                }
                assertThat(union).isEqualTo(expected);
                assertThat(total).isEqualTo(expected.getCardinality());
            }
        }
    }

    @Test
    @DisplayName("Should fill very large regions without recursion")
    void testLargeRegion() {
        Grid grid = new Grid(600, 600, 'x');

        List<GridComponent> components = engine.findConnectedComponents(grid, 'x');

        assertThat(components).hasSize(1);
        assertThat(components.get(0).cellCount()).isEqualTo(360_000);
    }

    @Test
    @DisplayName("Should split boundary and interior cells of a solid block")
    void testBoundaryAndInterior() {
        Grid grid = Grid.fromLines(List.of("####", "####", "####"));

        GridComponent block = engine.findConnectedComponents(grid, '#').get(0);

        assertThat(block.bounds()).isEqualTo(new BoundingBox(0, 0, 3, 2));
        assertThat(block.interiorCount()).isEqualTo(2);
        assertThat(block.boundaryCount()).isEqualTo(10);
        assertThat(block.boundaryCount() + block.interiorCount()).isEqualTo(block.cellCount());
        assertThat(block.content()).containsEntry('#', 12);
    }

    @Test
    @DisplayName("Should render content lines with non-member cells blanked")
    void testContentLines() {
        Grid grid = Grid.fromLines(List.of("+----+", "|[OK]|", "+----+"));

        GridComponent ring = engine.findConnectedComponents(grid, CellPredicate.ofChars("+-|")).get(0);

        assertThat(ring.contentLines()).containsExactly("+----+", "|    |", "+----+");
        assertThat(ring.cellCount()).isEqualTo(14);
    }

    @Test
    @DisplayName("Should distinguish four and eight connectivity on diagonals")
    void testDiagonalConnectivity() {
        Grid grid = Grid.fromLines(List.of("#.", ".#"));

        assertThat(new FloodFillEngine(Connectivity.FOUR).findConnectedComponents(grid, '#')).hasSize(2);
        assertThat(new FloodFillEngine(Connectivity.EIGHT).findConnectedComponents(grid, '#')).hasSize(1);
    }

    @Test
    @DisplayName("Should replace a region and report the number of cells changed")
    void testFloodFillReplacement() {
        Grid grid = Grid.fromLines(List.of("..#", ".##", "#.."));

        int replaced = engine.floodFill(grid, 0, 0, '.', 'o');

        assertThat(replaced).isEqualTo(3);
        assertThat(grid.toLines()).containsExactly("oo#", "o##", "#..");
        assertThat(engine.floodFill(grid, 2, 0, '.', 'o')).isZero();
    }
}
