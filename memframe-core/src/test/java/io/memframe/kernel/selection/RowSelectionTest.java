package io.memframe.kernel.selection;

import io.memframe.core.LengthMismatchException;
import io.memframe.core.OutOfBoundsException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RowSelectionTest {

    @Test
    void maskBecomesAscendingPositions() {
        var selection = RowSelection.fromMask(new boolean[]{false, true, false, true, true}, 5);

        assertThat(selection.toIntArray()).containsExactly(1, 3, 4);
    }

    @Test
    void maskOfWrongLengthFails() {
        assertThatThrownBy(() -> RowSelection.fromMask(new boolean[4], 5))
                .isInstanceOf(LengthMismatchException.class);
    }

    @Test
    void positionsAreBoundsChecked() {
        assertThat(RowSelection.of(new int[]{2, 2, 0}, 3).toIntArray()).containsExactly(2, 2, 0);
        assertThatThrownBy(() -> RowSelection.of(new int[]{3}, 3)).isInstanceOf(OutOfBoundsException.class);
        assertThatThrownBy(() -> RowSelection.of(new int[]{-1}, 3)).isInstanceOf(OutOfBoundsException.class);
    }

    @Test
    void composeMapsThroughOuterPositions() {
        var outer = RowSelection.of(new int[]{4, 2, 0}, 5);
        var inner = RowSelection.of(new int[]{2, 0}, 3);

        assertThat(outer.compose(inner).toIntArray()).containsExactly(0, 4);
    }

    @Test
    void resolveHandlesEveryRowSelector() {
        assertThat(RowSelection.resolve(Selector.ALL, 3).toIntArray()).containsExactly(0, 1, 2);
        assertThat(RowSelection.resolve(new Selector.Position(1), 3).toIntArray()).containsExactly(1);
        assertThat(RowSelection.resolve(new Selector.Mask(new boolean[]{true, false, true}), 3).toIntArray())
                .containsExactly(0, 2);
        assertThatThrownBy(() -> RowSelection.resolve(new Selector.Name("a"), 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rangesAndReversal() {
        assertThat(RowSelection.range(1, 4).reversed().toIntArray()).containsExactly(3, 2, 1);
        assertThat(RowSelection.empty().isEmpty()).isTrue();
        assertThat(RowSelection.all(2)).isEqualTo(RowSelection.range(0, 2));
        assertThatThrownBy(() -> RowSelection.range(2, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void iteratorWalksPositions() {
        var iterator = RowSelection.of(new int[]{1, 0}, 2).iterator();

        assertThat(iterator.nextInt()).isEqualTo(1);
        assertThat(iterator.nextInt()).isEqualTo(0);
        assertThat(iterator.hasNext()).isFalse();
    }
}
