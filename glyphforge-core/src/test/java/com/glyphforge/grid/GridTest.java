package com.glyphforge.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridTest {

    @Test
    @DisplayName("Should build grid from equal-length rows")
    void testFromLines() {
        Grid grid = Grid.fromLines(List.of("+--+", "|ab|", "+--+"));

        assertThat(grid.width()).isEqualTo(4);
        assertThat(grid.height()).isEqualTo(3);
        assertThat(grid.get(1, 1)).isEqualTo('a');
        assertThat(grid.row(2)).isEqualTo("+--+");
    }

    @Test
    @DisplayName("Should reject ragged rows instead of padding them")
    void testRaggedRowsRejected() {
        assertThatThrownBy(() -> Grid.fromLines(List.of("abc", "ab")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Row 1");
    }

    @Test
    @DisplayName("Should pad short rows when explicitly requested")
    void testPaddedConstruction() {
        Grid grid = Grid.fromLinesPadded(List.of("abc", "a"));

        assertThat(grid.toLines()).containsExactly("abc", "a  ");
    }

    @Test
    @DisplayName("Should bounds-check every access")
    void testBoundsChecked() {
        Grid grid = new Grid(2, 2, '.');

        assertThatThrownBy(() -> grid.get(2, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> grid.set(0, -1, 'x')).isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(grid.isInBounds(1, 1)).isTrue();
    }

    @Test
    @DisplayName("Should copy and replace sub-regions")
    void testSubGridAndReplace() {
        Grid grid = Grid.fromLines(List.of("abcd", "efgh", "ijkl"));

        Grid sub = grid.subGrid(1, 1, 2, 2);
        assertThat(sub.toLines()).containsExactly("fg", "jk");

        grid.replaceRegion(2, 0, Grid.fromLines(List.of("XY")));
        assertThat(grid.row(0)).isEqualTo("abXY");
        assertThat(sub.get(0, 0)).isEqualTo('f');
    }

    @Test
    @DisplayName("Should split text on line breaks ignoring one trailing newline")
    void testFromText() {
        Grid grid = Grid.fromText("ab\r\nc\n");

        assertThat(grid.height()).isEqualTo(2);
        assertThat(grid.toLines()).containsExactly("ab", "c ");
    }

    @Test
    @DisplayName("Should reject text whose padded size exceeds the cell limit")
    void testFromTextCellLimit() {
        String text = "x\n" + "y".repeat(50) + "\nz";

        assertThatThrownBy(() -> Grid.fromText(text, 149))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Grid of 50x3 cells exceeds the maximum of 149 cells");
        assertThat(Grid.fromText(text, 150).cellCount()).isEqualTo(150L);
    }

    @Test
    @DisplayName("Should reject text whose padded size overflows an int before allocating it")
    void testFromTextCellLimitOverflow() {
        String text = "x".repeat(70_000) + "\n".repeat(69_999);

        assertThatThrownBy(() -> Grid.fromText(text, Integer.MAX_VALUE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Grid of 70000x70000 cells exceeds the maximum of 2147483647 cells");
    }
}
