package io.memframe.kernel.selection;

/**
 * Normalizes raw addressing arguments into one of the six {@link Access} shapes.
 * <p>
 * Only the kinds of the arguments matter here; resolution against a concrete
 * table (names, bounds, mask lengths) happens later.
 */
public final class AccessPlanner {

    private AccessPlanner() {
    }

    /**
     * Column-only addressing, {@code table[columns]}.
     */
    public static Access plan(Object columns) {
        Selector column = Selector.classify(columns);
        return column.isSingle() ? new Access.ColumnSingle(column) : new Access.ColumnMulti(column);
    }

    /**
     * Row and column addressing, {@code table[rows, columns]}.
     *
     * @throws IllegalArgumentException if rows are addressed by name
     */
    public static Access plan(Object rows, Object columns) {
        Selector row = Selector.classify(rows);
        Selector column = Selector.classify(columns);
        if (row instanceof Selector.Name || row instanceof Selector.Keys) {
            throw new IllegalArgumentException("Rows cannot be addressed by name: " + rows);
        }
        if (row instanceof Selector.Position single) {
            return column.isSingle()
                    ? new Access.CellSingle(single.position(), column)
                    : new Access.RowSingleColumnMulti(single.position(), column);
        }
        return column.isSingle()
                ? new Access.RowMultiColumnSingle(row, column)
                : new Access.RowMultiColumnMulti(row, column);
    }
}
