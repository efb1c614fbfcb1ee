package io.memframe.table;

import io.memframe.core.OutOfBoundsException;
import io.memframe.kernel.RowKey;
import io.memframe.kernel.Table;
import io.memframe.kernel.selection.Selector;

import java.util.AbstractMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Single-row handle into a table or view. Reads and writes go to
 * {@code table[row, name]}; nothing is copied unless {@link #toTable()} is called.
 */
public final class RowView implements Iterable<Map.Entry<String, Object>> {

    private final Table table;
    private final int row;

    /**
     * @throws OutOfBoundsException if {@code row} is not a row of {@code table}
     */
    public RowView(Table table, int row) {
        if (row < 0 || row >= table.rowCount()) {
            throw OutOfBoundsException.of(row, table.rowCount());
        }
        this.table = table;
        this.row = row;
    }

    public Table table() {
        return table;
    }

    public int row() {
        return row;
    }

    public Object get(Object column) {
        return table.value(row, column);
    }

    public void set(Object column, Object value) {
        table.set(row, column, value);
    }

    /**
     * Same row, restricted to the given columns.
     */
    public RowView restrict(Object columns) {
        return new RowView(table.select(columns), row);
    }

    public List<String> names() {
        return table.names();
    }

    public int size() {
        return table.columnCount();
    }

    public Object[] values() {
        return table.rowValues(row);
    }

    /**
     * One-row table holding a copy of this row.
     */
    public DataTable toTable() {
        return (DataTable) table.get(row, Selector.ALL);
    }

    public Map<String, Object> toMap() {
        var result = new LinkedHashMap<String, Object>();
        for (Map.Entry<String, Object> field : this) {
            result.put(field.getKey(), field.getValue());
        }
        return result;
    }

    public RowKey key() {
        return RowKey.of(table, row);
    }

    @Override
    public Iterator<Map.Entry<String, Object>> iterator() {
        var names = names();
        return new Iterator<>() {
            private int column;

            @Override
            public boolean hasNext() {
                return column < names.size();
            }

            @Override
            public Map.Entry<String, Object> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                var name = names.get(column);
                return new AbstractMap.SimpleImmutableEntry<>(name, table.value(row, column++));
            }
        };
    }

    @Override
    public String toString() {
        return "RowView[" + row + "]" + toMap();
    }
}
