package io.memframe.table;

import io.memframe.core.MemframeConfiguration;
import io.memframe.core.OutOfBoundsException;
import io.memframe.kernel.ColumnIndex;
import io.memframe.kernel.Table;
import io.memframe.kernel.selection.RowSelection;
import io.memframe.kernel.selection.Selector;
import io.memframe.storage.Column;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Non-owning row subset of a {@link DataTable}.
 * <p>
 * Rows of the view are mapped through its {@link RowSelection} and every read or write
 * is delegated to the parent, so cell writes through a view are visible in the parent.
 * A view over a view composes both selections into one.
 * <p>
 * A view must not be used after a structural change of its parent (rows or columns
 * added or removed).
 */
public final class TableView implements Table, Iterable<RowView> {

    private final DataTable parent;
    private final RowSelection rows;

    private TableView(DataTable parent, RowSelection rows) {
        this.parent = parent;
        this.rows = rows;
    }

    /**
     * @throws OutOfBoundsException if a position is outside the parent's rows
     */
    public static TableView of(DataTable parent, RowSelection rows) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(rows, "rows");
        return new TableView(parent, RowSelection.of(rows.toIntArray(), parent.rowCount()));
    }

    public DataTable parent() {
        return parent;
    }

    /**
     * Parent row positions, in view order.
     */
    public RowSelection positions() {
        return rows;
    }

    @Override
    public int rowCount() {
        return rows.size();
    }

    @Override
    public int columnCount() {
        return parent.columnCount();
    }

    @Override
    public ColumnIndex index() {
        return parent.index();
    }

    @Override
    public List<String> names() {
        return parent.names();
    }

    @Override
    public MemframeConfiguration configuration() {
        return parent.configuration();
    }

    /**
     * Values of the column at the view's rows, as a new column.
     */
    @Override
    public Column<?> column(Object key) {
        return parent.column(key).gather(rows.toIntArray());
    }

    @Override
    public Object value(int row, Object column) {
        return parent.value(rows.get(row), column);
    }

    /**
     * A new column for a single key, a view over the selected columns otherwise.
     */
    @Override
    public Object get(Object columns) {
        var selector = Selector.classify(columns);
        return selector.isSingle() ? column(columns) : select(selector);
    }

    @Override
    public Object get(Object rows, Object columns) {
        return parent.get(parentRows(rows), columns);
    }

    /**
     * Writes the value into every row of the view. Columns must already exist.
     */
    @Override
    public void set(Object columns, Object value) {
        parent.set(rows.toIntArray(), columns, value);
    }

    @Override
    public void set(Object rows, Object columns, Object value) {
        parent.set(parentRows(rows), columns, value);
    }

    /**
     * View with the same rows over the selected columns.
     */
    @Override
    public TableView select(Object columns) {
        return new TableView(parent.select(columns), rows);
    }

    @Override
    public TableView view(Object rows) {
        return new TableView(parent, this.rows.compose(RowSelection.resolve(Selector.classify(rows), rowCount())));
    }

    public RowView row(int row) {
        return new RowView(this, row);
    }

    /**
     * Copy of the visible rows as an owning table.
     */
    public DataTable toTable() {
        return parent.slice(rows.toIntArray(), Selector.ALL);
    }

    /**
     * View with the same rows without the given columns.
     */
    public TableView without(Object columns) {
        return new TableView(parent.without(columns), rows);
    }

    @Override
    public Iterator<RowView> iterator() {
        return new Iterator<>() {
            private int row;

            @Override
            public boolean hasNext() {
                return row < rowCount();
            }

            @Override
            public RowView next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return new RowView(TableView.this, row++);
            }
        };
    }

    /**
     * Rows relative to this view mapped to parent rows; a single row stays a single row.
     */
    private Object parentRows(Object rows) {
        var selector = Selector.classify(rows);
        if (selector instanceof Selector.Position single) {
            return this.rows.get(single.position());
        }
        if (selector instanceof Selector.Name || selector instanceof Selector.Keys) {
            throw new IllegalArgumentException("Rows cannot be addressed by name: " + rows);
        }
        return this.rows.compose(RowSelection.resolve(selector, rowCount())).toIntArray();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Table other && TableComparisons.isEquivalent(this, other);
    }

    @Override
    public int hashCode() {
        return TableComparisons.hash(this);
    }

    @Override
    public String toString() {
        return "TableView[" + rowCount() + " of " + parent.rowCount() + " rows, " + names() + "]";
    }
}
