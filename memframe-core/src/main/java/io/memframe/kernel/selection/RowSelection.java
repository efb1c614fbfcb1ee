package io.memframe.kernel.selection;

import io.memframe.core.LengthMismatchException;
import io.memframe.core.OutOfBoundsException;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Immutable, validated sequence of row positions.
 * <p>
 * Positions may repeat and need not be sorted. Every position lies in
 * {@code [0, bound)} of the table it was validated against.
 */
public final class RowSelection {

    private static final RowSelection EMPTY = new RowSelection(new int[0]);

    private final int[] positions;

    private RowSelection(int[] positions) {
        this.positions = positions;
    }

    public static RowSelection empty() {
        return EMPTY;
    }

    /**
     * Positions {@code 0 .. rowCount - 1}.
     */
    public static RowSelection all(int rowCount) {
        return range(0, rowCount);
    }

    public static RowSelection range(int fromInclusive, int toExclusive) {
        if (fromInclusive < 0 || toExclusive < fromInclusive) {
            throw new IllegalArgumentException("invalid range: [" + fromInclusive + ", " + toExclusive + ")");
        }
        var positions = new int[toExclusive - fromInclusive];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = fromInclusive + i;
        }
        return new RowSelection(positions);
    }

    /**
     * @throws OutOfBoundsException if any position is outside {@code [0, bound)}
     */
    public static RowSelection of(int[] positions, int bound) {
        for (int position : positions) {
            if (position < 0 || position >= bound) {
                throw OutOfBoundsException.of(position, bound);
            }
        }
        return new RowSelection(positions.clone());
    }

    /**
     * Ascending positions of the {@code true} entries.
     *
     * @throws LengthMismatchException if the mask does not have exactly {@code rowCount} entries
     */
    public static RowSelection fromMask(boolean[] mask, int rowCount) {
        if (mask.length != rowCount) {
            throw LengthMismatchException.of("row mask", rowCount, mask.length);
        }
        int count = 0;
        for (boolean flag : mask) {
            if (flag) {
                count++;
            }
        }
        var positions = new int[count];
        int next = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                positions[next++] = i;
            }
        }
        return new RowSelection(positions);
    }

    /**
     * Resolve a classified row selector against a table of {@code rowCount} rows.
     *
     * @throws IllegalArgumentException for name-based selectors, which address columns only
     */
    public static RowSelection resolve(Selector selector, int rowCount) {
        if (selector instanceof Selector.All) {
            return all(rowCount);
        }
        if (selector instanceof Selector.Position single) {
            return of(new int[]{single.position()}, rowCount);
        }
        if (selector instanceof Selector.Positions multi) {
            return of(multi.positions(), rowCount);
        }
        if (selector instanceof Selector.Mask mask) {
            return fromMask(mask.mask(), rowCount);
        }
        throw new IllegalArgumentException("Rows cannot be addressed by name: " + selector);
    }

    public int size() {
        return positions.length;
    }

    public boolean isEmpty() {
        return positions.length == 0;
    }

    public int get(int index) {
        if (index < 0 || index >= positions.length) {
            throw OutOfBoundsException.of(index, positions.length);
        }
        return positions[index];
    }

    /**
     * Map positions relative to this selection to positions of the underlying table:
     * {@code result[i] = this.get(inner[i])}.
     */
    public RowSelection compose(RowSelection inner) {
        var mapped = new int[inner.positions.length];
        for (int i = 0; i < mapped.length; i++) {
            mapped[i] = get(inner.positions[i]);
        }
        return new RowSelection(mapped);
    }

    public RowSelection reversed() {
        var reversed = new int[positions.length];
        for (int i = 0; i < positions.length; i++) {
            reversed[i] = positions[positions.length - 1 - i];
        }
        return new RowSelection(reversed);
    }

    public int[] toIntArray() {
        return positions.clone();
    }

    public PrimitiveIterator.OfInt iterator() {
        return new PrimitiveIterator.OfInt() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < positions.length;
            }

            @Override
            public int nextInt() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return positions[index++];
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RowSelection other && Arrays.equals(positions, other.positions);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(positions);
    }

    @Override
    public String toString() {
        return "RowSelection" + Arrays.toString(positions);
    }
}
