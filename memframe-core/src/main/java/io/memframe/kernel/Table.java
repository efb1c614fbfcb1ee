package io.memframe.kernel;

import io.memframe.core.ColumnType;
import io.memframe.core.MemframeConfiguration;
import io.memframe.storage.Column;

import java.util.ArrayList;
import java.util.List;

/**
 * Table-like object: an owning table or a row view over one.
 * <p>
 * Addressing arguments are names ({@code String}), 0-based positions
 * ({@code Integer}/{@code Long}), sequences of either, boolean masks, or
 * {@link io.memframe.kernel.selection.Selector#ALL}. The generic
 * {@link #get}/{@link #set} entry points accept all six shapes
 * ({@code [columns]} and {@code [rows, columns]} with single or multiple keys);
 * the typed accessors are shortcuts for specific shapes.
 * <p>
 * <b>Thread-safety:</b> none. Tables, their shallow copies and their views share
 * column storage; external synchronization is required for shared tables.
 */
public interface Table {

    /**
     * Deletion marker for {@link #set(Object, Object)}.
     */
    Object ABSENT = Absent.INSTANCE;

    int rowCount();

    int columnCount();

    /**
     * Snapshot of the column index. Mutating it does not affect the table.
     */
    ColumnIndex index();

    List<String> names();

    MemframeConfiguration configuration();

    /**
     * Single column by name or position.
     */
    Column<?> column(Object key);

    /**
     * Single cell, {@code null} for NA.
     */
    Object value(int row, Object column);

    /**
     * {@code table[columns]}: a {@link Column} for a single key, a table otherwise.
     */
    Object get(Object columns);

    /**
     * {@code table[rows, columns]}: a scalar, a {@link Column} or a table depending on the shape.
     */
    Object get(Object rows, Object columns);

    /**
     * {@code table[columns] = value}.
     */
    void set(Object columns, Object value);

    /**
     * {@code table[rows, columns] = value}.
     */
    void set(Object rows, Object columns, Object value);

    /**
     * Columns by names, positions or mask, sharing column storage where the table owns it.
     */
    Table select(Object columns);

    /**
     * Non-copying row subset.
     */
    Table view(Object rows);

    default List<ColumnType> types() {
        var types = new ArrayList<ColumnType>(columnCount());
        for (int i = 0; i < columnCount(); i++) {
            types.add(column(i).type());
        }
        return types;
    }

    /**
     * Whether the table has no columns.
     */
    default boolean isEmpty() {
        return columnCount() == 0;
    }

    default boolean containsColumn(Object key) {
        return index().contains(key);
    }

    default Object getOrDefault(Object key, Object defaultValue) {
        return containsColumn(key) ? column(key) : defaultValue;
    }

    /**
     * Values of one row in column order.
     */
    default Object[] rowValues(int row) {
        var values = new Object[columnCount()];
        for (int j = 0; j < values.length; j++) {
            values[j] = value(row, j);
        }
        return values;
    }
}
