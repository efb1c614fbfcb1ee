package io.memframe.kernel.selection;

/**
 * The six addressing shapes of a table read or write.
 * <p>
 * Row parts stay unresolved {@link Selector}s because a view maps them through
 * its own positions before the owning table resolves them.
 */
public sealed interface Access permits Access.ColumnSingle, Access.ColumnMulti, Access.CellSingle,
        Access.RowSingleColumnMulti, Access.RowMultiColumnSingle, Access.RowMultiColumnMulti {

    record ColumnSingle(Selector column) implements Access {
    }

    record ColumnMulti(Selector columns) implements Access {
    }

    record CellSingle(int row, Selector column) implements Access {
    }

    record RowSingleColumnMulti(int row, Selector columns) implements Access {
    }

    record RowMultiColumnSingle(Selector rows, Selector column) implements Access {
    }

    record RowMultiColumnMulti(Selector rows, Selector columns) implements Access {
    }
}
