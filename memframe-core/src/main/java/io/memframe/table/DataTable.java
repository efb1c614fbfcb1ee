package io.memframe.table;

import io.memframe.core.ColumnType;
import io.memframe.core.EmptyResultException;
import io.memframe.core.IndexMismatchException;
import io.memframe.core.LengthMismatchException;
import io.memframe.core.MemframeConfiguration;
import io.memframe.core.NonContiguousInsertException;
import io.memframe.core.Ternary;
import io.memframe.kernel.ColumnIndex;
import io.memframe.kernel.Table;
import io.memframe.kernel.selection.AccessPlanner;
import io.memframe.kernel.selection.RowSelection;
import io.memframe.kernel.selection.Selector;
import io.memframe.storage.Column;
import io.memframe.storage.Columns;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Owning table: an ordered list of equal-length columns plus their {@link ColumnIndex}.
 * <p>
 * <b>Invariants</b> (checked at construction and kept by every mutation):
 * <ul>
 *   <li>With more than one column, all columns have the same length.</li>
 *   <li>The index has exactly one name per column, in column order.</li>
 * </ul>
 * <p>
 * <b>Copies:</b> {@link #copy()} shares column instances with the original. Replacing a
 * column in either table (any column write) never affects the other; writing cells of a
 * shared column is visible through both, exactly as for {@link TableView}s.
 * {@link #deepCopy()} gives independent storage.
 * <p>
 * <b>Thread-safety:</b> not thread-safe; external synchronization required for shared tables.
 */
public final class DataTable implements Table, Iterable<RowView> {

    private final List<Column<?>> columns;
    private final ColumnIndex index;
    private final MemframeConfiguration configuration;
    private final TableIndexer indexer;

    /**
     * @throws LengthMismatchException if the columns disagree in length
     * @throws IndexMismatchException if the index size differs from the column count
     */
    public DataTable(List<? extends Column<?>> columns, ColumnIndex index) {
        this(columns, index, MemframeConfiguration.defaults());
    }

    public DataTable(List<? extends Column<?>> columns, ColumnIndex index, MemframeConfiguration configuration) {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(index, "index");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        for (Column<?> column : columns) {
            if (column == null) {
                throw new IllegalArgumentException("columns must not contain null");
            }
        }
        if (columns.size() > 1) {
            int rows = columns.get(0).length();
            for (int i = 1; i < columns.size(); i++) {
                if (columns.get(i).length() != rows) {
                    throw new LengthMismatchException("All columns in a table must be the same length: column "
                            + i + " has " + columns.get(i).length() + " rows, expected " + rows);
                }
            }
        }
        if (index.size() != columns.size()) {
            throw new IndexMismatchException("Columns and column index must be the same length: "
                    + columns.size() + " columns, " + index.size() + " names");
        }
        this.columns = new ArrayList<>(columns);
        this.index = index.copy();
        this.indexer = new TableIndexer(this);
    }

    // ===== CONSTRUCTION =====

    public static DataTable empty() {
        return empty(MemframeConfiguration.defaults());
    }

    public static DataTable empty(MemframeConfiguration configuration) {
        return new DataTable(List.of(), new ColumnIndex(), configuration);
    }

    public static DataTable of(List<? extends Column<?>> columns, List<String> names) {
        return new DataTable(columns, new ColumnIndex(names));
    }

    /**
     * Columns named {@code x1 .. xn}.
     */
    public static DataTable of(List<? extends Column<?>> columns) {
        var configuration = MemframeConfiguration.defaults();
        return new DataTable(columns,
                new ColumnIndex(ColumnIndex.generatedNames(columns.size(), configuration.generatedNamePrefix())),
                configuration);
    }

    /**
     * All-NA table of the configured default column type with generated names.
     */
    public static DataTable withShape(int rows, int columnCount) {
        return withShape(rows, columnCount, MemframeConfiguration.defaults());
    }

    public static DataTable withShape(int rows, int columnCount, MemframeConfiguration configuration) {
        var types = new ArrayList<ColumnType>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            types.add(configuration.defaultColumnType());
        }
        return withTypes(types,
                ColumnIndex.generatedNames(columnCount, configuration.generatedNamePrefix()), rows, configuration);
    }

    public static DataTable withTypes(List<ColumnType> types, int rows) {
        var configuration = MemframeConfiguration.defaults();
        return withTypes(types,
                ColumnIndex.generatedNames(types.size(), configuration.generatedNamePrefix()), rows, configuration);
    }

    /**
     * All-NA table with the given column types and names.
     */
    public static DataTable withTypes(List<ColumnType> types, List<String> names, int rows) {
        return withTypes(types, names, rows, MemframeConfiguration.defaults());
    }

    public static DataTable withTypes(List<ColumnType> types, List<String> names, int rows,
                                      MemframeConfiguration configuration) {
        var columns = new ArrayList<Column<?>>(types.size());
        for (ColumnType type : types) {
            columns.add(Columns.allNa(type, rows));
        }
        return new DataTable(columns, new ColumnIndex(names), configuration);
    }

    /**
     * One row per record; columns are the union of all keys in first-seen order.
     */
    public static DataTable fromRecords(List<? extends Map<String, ?>> records) {
        var keys = new LinkedHashSet<String>();
        for (Map<String, ?> record : records) {
            keys.addAll(record.keySet());
        }
        return fromRecords(records, new ArrayList<>(keys));
    }

    /**
     * One row per record and one column per key. Each column's type is the promotion of
     * its non-NA values ({@code OBJECT} when it has none); absent keys are NA.
     */
    public static DataTable fromRecords(List<? extends Map<String, ?>> records, List<String> keys) {
        var columns = new ArrayList<Column<?>>(keys.size());
        for (String key : keys) {
            var values = new ArrayList<Object>(records.size());
            for (Map<String, ?> record : records) {
                values.add(record.get(key));
            }
            columns.add(Columns.fromValues(values, ColumnType.OBJECT));
        }
        return of(columns, keys);
    }

    // ===== SHAPE =====

    @Override
    public int rowCount() {
        return columns.isEmpty() ? 0 : columns.get(0).length();
    }

    @Override
    public int columnCount() {
        return index.size();
    }

    @Override
    public ColumnIndex index() {
        return index.copy();
    }

    @Override
    public List<String> names() {
        return index.names();
    }

    @Override
    public MemframeConfiguration configuration() {
        return configuration;
    }

    public void setNames(List<String> names) {
        index.setNames(names);
    }

    public void rename(String from, String to) {
        index.rename(from, to);
    }

    public void rename(Map<String, String> renames) {
        index.rename(renames);
    }

    /**
     * Trim names, replace non-word characters with {@code _}, then de-duplicate.
     */
    public void cleanNames() {
        var cleaned = new ArrayList<String>(columnCount());
        for (String name : names()) {
            cleaned.add(name.strip().replaceAll("\\W", "_"));
        }
        index.setNames(ColumnIndex.makeUnique(cleaned, configuration.uniqueNameSeparator()));
    }

    // ===== READ =====

    /**
     * The column itself, not a copy.
     */
    @Override
    public Column<?> column(Object key) {
        return columns.get(index.position(key));
    }

    @Override
    public Object value(int row, Object column) {
        return indexer.read(AccessPlanner.plan(row, column));
    }

    @Override
    public Object get(Object columns) {
        return indexer.read(AccessPlanner.plan(columns));
    }

    @Override
    public Object get(Object rows, Object columns) {
        return indexer.read(AccessPlanner.plan(rows, columns));
    }

    /**
     * New table sharing the selected columns. A single key selects a one-column table.
     */
    @Override
    public DataTable select(Object columns) {
        return indexer.selectColumns(indexer.resolveColumns(Selector.classify(columns)));
    }

    /**
     * Values of one column at the selected rows, as a new column.
     */
    public Column<?> cells(Object rows, Object column) {
        var rowSelection = RowSelection.resolve(Selector.classify(rows), rowCount());
        return column(column).gather(rowSelection.toIntArray());
    }

    /**
     * Copy of the selected rows and columns; always a table, even for single keys.
     */
    public DataTable slice(Object rows, Object columns) {
        var rowSelection = RowSelection.resolve(Selector.classify(rows), rowCount());
        var selected = select(columns);
        var gathered = new ArrayList<Column<?>>(selected.columnCount());
        for (Column<?> column : selected.columns) {
            gathered.add(column.gather(rowSelection.toIntArray()));
        }
        return new DataTable(gathered, selected.index, configuration);
    }

    /**
     * Copy of the selected rows with every column.
     */
    public DataTable rows(Object rows) {
        return slice(rows, Selector.ALL);
    }

    @Override
    public TableView view(Object rows) {
        return TableView.of(this, RowSelection.resolve(Selector.classify(rows), rowCount()));
    }

    public RowView row(int row) {
        return new RowView(this, row);
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
                return new RowView(DataTable.this, row++);
            }
        };
    }

    public DataTable head() {
        return head(configuration.headSize());
    }

    public DataTable head(int rows) {
        return this.rows(RowSelection.range(0, Math.min(Math.max(rows, 0), rowCount())).toIntArray());
    }

    public DataTable tail() {
        return tail(configuration.headSize());
    }

    public DataTable tail(int rows) {
        int total = rowCount();
        return this.rows(RowSelection.range(Math.max(0, total - Math.max(rows, 0)), total).toIntArray());
    }

    // ===== WRITE =====

    @Override
    public void set(Object columns, Object value) {
        indexer.write(AccessPlanner.plan(columns), value);
    }

    @Override
    public void set(Object rows, Object columns, Object value) {
        indexer.write(AccessPlanner.plan(rows, columns), value);
    }

    /**
     * Insert a column at {@code position}, shifting later columns right.
     *
     * @throws NonContiguousInsertException if {@code position > columnCount()}
     */
    public void insertColumn(int position, String name, Object value) {
        if (position < 0 || position > columnCount()) {
            throw new NonContiguousInsertException("Cannot insert at position " + position
                    + " of a table with " + columnCount() + " columns");
        }
        Column<?> column;
        if (Columns.isVectorLike(value)) {
            column = Columns.toColumn(value, configuration.defaultColumnType());
        } else {
            int rows = columns.isEmpty() ? 1 : rowCount();
            column = Columns.filled(value, rows, configuration.defaultColumnType());
        }
        if (!columns.isEmpty() && column.length() != rowCount()) {
            throw LengthMismatchException.of("column '" + name + "'", rowCount(), column.length());
        }
        index.insert(position, name);
        columns.add(position, column);
    }

    /**
     * Add or replace every column of {@code other} by name.
     */
    public void insertAll(Table other) {
        if (columnCount() > 0 && other.columnCount() > 0 && other.rowCount() != rowCount()) {
            throw LengthMismatchException.of("inserted table rows", rowCount(), other.rowCount());
        }
        for (String name : other.names()) {
            set(name, other.column(name));
        }
    }

    public void deleteColumn(Object key) {
        removeColumn(index.position(key));
    }

    public void deleteColumns(Object keys) {
        removeColumns(indexer.resolveColumns(Selector.classify(keys)));
    }

    /**
     * New table without the given columns, sharing the remaining ones.
     *
     * @throws EmptyResultException if no column would remain
     */
    public DataTable without(Object keys) {
        var removed = indexer.resolveColumns(Selector.classify(keys));
        var keep = new boolean[columnCount()];
        Arrays.fill(keep, true);
        for (int position : removed) {
            keep[position] = false;
        }
        var remaining = index.positions(keep);
        if (remaining.length == 0) {
            throw new EmptyResultException("Removing " + removed.length + " columns would leave an empty table");
        }
        return indexer.selectColumns(remaining);
    }

    /**
     * Keep only the selected rows, in selection order.
     */
    public void keepRows(Object rows) {
        int[] kept = RowSelection.resolve(Selector.classify(rows), rowCount()).toIntArray();
        for (int i = 0; i < columns.size(); i++) {
            columns.set(i, columns.get(i).gather(kept));
        }
    }

    /**
     * Remove the selected rows.
     */
    public void deleteRows(Object rows) {
        int[] removed = RowSelection.resolve(Selector.classify(rows), rowCount()).toIntArray();
        var keep = new boolean[rowCount()];
        Arrays.fill(keep, true);
        for (int row : removed) {
            keep[row] = false;
        }
        keepRows(keep);
    }

    /**
     * Mask of rows without any NA.
     */
    public boolean[] completeCases() {
        var complete = new boolean[rowCount()];
        Arrays.fill(complete, true);
        for (Column<?> column : columns) {
            for (int row = 0; row < complete.length; row++) {
                if (column.isNa(row)) {
                    complete[row] = false;
                }
            }
        }
        return complete;
    }

    public void dropIncompleteRows() {
        keepRows(completeCases());
    }

    /**
     * Mask of rows that repeat an earlier row.
     */
    public boolean[] duplicated() {
        return Duplicates.duplicated(this);
    }

    public DataTable unique() {
        return rows(Duplicates.firstOccurrences(this));
    }

    public void dropDuplicates() {
        keepRows(Duplicates.firstOccurrences(this));
    }

    /**
     * Copy with rows in reverse order.
     */
    public DataTable flip() {
        return rows(RowSelection.all(rowCount()).reversed().toIntArray());
    }

    /**
     * Reverse the row order by rewriting cells, so shallow copies and views see the change.
     */
    public void flipInPlace() {
        var all = RowSelection.all(rowCount());
        int[] reversed = all.reversed().toIntArray();
        // Gather everything first: one column instance may sit in several slots
        List<Column<?>> flipped = new ArrayList<>(columns.size());
        for (Column<?> column : columns) {
            flipped.add(column.gather(reversed));
        }
        for (int i = 0; i < columns.size(); i++) {
            columns.get(i).scatter(all.toIntArray(), flipped.get(i));
        }
    }

    // ===== COPIES & CONVERSION =====

    /**
     * Shallow copy: new column list and index, same column instances.
     */
    public DataTable copy() {
        return new DataTable(columns, index, configuration);
    }

    public DataTable deepCopy() {
        var copies = new ArrayList<Column<?>>(columns.size());
        for (Column<?> column : columns) {
            copies.add(column.copy());
        }
        return new DataTable(copies, index, configuration);
    }

    /**
     * Same names and types, {@code rows} all-NA rows.
     */
    public DataTable allNaLike(int rows) {
        var nas = new ArrayList<Column<?>>(columns.size());
        for (Column<?> column : columns) {
            nas.add(Columns.allNa(column.type(), rows));
        }
        return new DataTable(nas, index, configuration);
    }

    /**
     * Row-major values, NA as {@code null}.
     */
    public Object[][] toArray() {
        var result = new Object[rowCount()][];
        for (int row = 0; row < result.length; row++) {
            result[row] = rowValues(row);
        }
        return result;
    }

    /**
     * Column name to column; when {@code flatten} is set and the table has one row,
     * column name to that row's value.
     */
    public Map<String, Object> toMap(boolean flatten) {
        var result = new LinkedHashMap<String, Object>();
        boolean scalars = flatten && rowCount() == 1;
        for (int i = 0; i < columns.size(); i++) {
            result.put(index.name(i), scalars ? columns.get(i).get(0) : columns.get(i));
        }
        return result;
    }

    public Map<String, Object> toMap() {
        return toMap(false);
    }

    public Collection<Column<?>> columns() {
        return List.copyOf(columns);
    }

    // ===== EQUALITY =====

    /**
     * {@code ==}: UNKNOWN when the only differences involve NA.
     */
    public Ternary equalTo(Table other) {
        return TableComparisons.equalTo(this, other);
    }

    /**
     * Identity-style equality: NA cells equal NA cells in the same position.
     */
    public boolean isEquivalent(Table other) {
        return TableComparisons.isEquivalent(this, other);
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
        var sb = new StringBuilder("DataTable[").append(rowCount()).append('x').append(columnCount());
        for (int i = 0; i < columns.size(); i++) {
            sb.append(i == 0 ? ": " : ", ").append(index.name(i)).append(' ').append(columns.get(i).type());
        }
        return sb.append(']').toString();
    }

    // ===== INTERNAL (TableIndexer) =====

    ColumnIndex liveIndex() {
        return index;
    }

    Column<?> columnAt(int position) {
        return columns.get(position);
    }

    void replaceColumn(int position, Column<?> column) {
        columns.set(position, column);
    }

    void appendColumn(String name, Column<?> column) {
        index.insert(name);
        columns.add(column);
    }

    void removeColumn(int position) {
        index.delete(position);
        columns.remove(position);
    }

    void removeColumns(int[] positions) {
        int[] sorted = Arrays.stream(positions).distinct().sorted().toArray();
        for (int i = sorted.length - 1; i >= 0; i--) {
            removeColumn(sorted[i]);
        }
    }
}
