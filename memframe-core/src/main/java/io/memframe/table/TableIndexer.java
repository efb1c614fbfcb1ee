package io.memframe.table;

import io.memframe.core.LengthMismatchException;
import io.memframe.core.NonContiguousInsertException;
import io.memframe.core.NonExistentTargetException;
import io.memframe.core.OutOfBoundsException;
import io.memframe.core.ShapeMismatchException;
import io.memframe.core.TypeMismatchException;
import io.memframe.core.UnknownColumnException;
import io.memframe.kernel.ColumnIndex;
import io.memframe.kernel.Table;
import io.memframe.kernel.selection.Access;
import io.memframe.kernel.selection.RowSelection;
import io.memframe.kernel.selection.Selector;
import io.memframe.storage.Column;
import io.memframe.storage.Columns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Read and write logic for the six {@link Access} shapes of a {@link DataTable}.
 * <p>
 * <b>Write policy:</b>
 * <ul>
 *   <li>Column writes ({@code [columns] = value}) replace or append whole columns and may
 *       fix the row count of a table that has no columns yet.</li>
 *   <li>A scalar, a one-row table or a single cell written to a row of a table with at most
 *       one row becomes a length-1 column per target (auto-grow).</li>
 *   <li>Row-range writes never create columns and never change the row count.</li>
 *   <li>A cell value that does not fit its column's element type is stored as NA; shape and
 *       identity errors always fail.</li>
 * </ul>
 */
final class TableIndexer {

    private static final Logger logger = LoggerFactory.getLogger(TableIndexer.class);

    private final DataTable table;

    TableIndexer(DataTable table) {
        this.table = table;
    }

    // ===== READ =====

    Object read(Access access) {
        if (access instanceof Access.ColumnSingle single) {
            return column(single.column());
        }
        if (access instanceof Access.ColumnMulti multi) {
            return selectColumns(resolveColumns(multi.columns()));
        }
        if (access instanceof Access.CellSingle cell) {
            var column = column(cell.column());
            checkRow(cell.row());
            return column.get(cell.row());
        }
        if (access instanceof Access.RowSingleColumnMulti rowMulti) {
            checkRow(rowMulti.row());
            return restrict(resolveColumns(rowMulti.columns()), new int[]{rowMulti.row()});
        }
        if (access instanceof Access.RowMultiColumnSingle rowsSingle) {
            var rows = RowSelection.resolve(rowsSingle.rows(), table.rowCount());
            return column(rowsSingle.column()).gather(rows.toIntArray());
        }
        var rowsMulti = (Access.RowMultiColumnMulti) access;
        var rows = RowSelection.resolve(rowsMulti.rows(), table.rowCount());
        return restrict(resolveColumns(rowsMulti.columns()), rows.toIntArray());
    }

    Column<?> column(Selector selector) {
        return table.columnAt(index().position(singleKey(selector)));
    }

    /**
     * New table sharing the selected columns.
     */
    DataTable selectColumns(int[] positions) {
        var selected = new ArrayList<Column<?>>(positions.length);
        for (int position : positions) {
            selected.add(table.columnAt(position));
        }
        return new DataTable(selected, index().select(positions), table.configuration());
    }

    private DataTable restrict(int[] columnPositions, int[] rows) {
        var selected = new ArrayList<Column<?>>(columnPositions.length);
        for (int position : columnPositions) {
            selected.add(table.columnAt(position).gather(rows));
        }
        return new DataTable(selected, index().select(columnPositions), table.configuration());
    }

    // ===== WRITE =====

    void write(Access access, Object value) {
        if (access instanceof Access.ColumnSingle single) {
            writeColumn(singleKey(single.column()), value);
        } else if (access instanceof Access.ColumnMulti multi) {
            writeColumns(columnKeys(multi.columns()), value);
        } else if (access instanceof Access.CellSingle cell) {
            requireNotAbsent(value);
            writeEntry(cell.row(), singleKey(cell.column()), value);
        } else if (access instanceof Access.RowSingleColumnMulti rowMulti) {
            requireNotAbsent(value);
            writeRowAcrossColumns(rowMulti.row(), columnKeys(rowMulti.columns()), value);
        } else if (access instanceof Access.RowMultiColumnSingle rowsSingle) {
            requireNotAbsent(value);
            var rows = RowSelection.resolve(rowsSingle.rows(), table.rowCount());
            writeRange(rows, new int[]{existingTarget(singleKey(rowsSingle.column()))}, value);
        } else {
            requireNotAbsent(value);
            var rowsMulti = (Access.RowMultiColumnMulti) access;
            var rows = RowSelection.resolve(rowsMulti.rows(), table.rowCount());
            var keys = columnKeys(rowsMulti.columns());
            var targets = new int[keys.size()];
            for (int j = 0; j < targets.length; j++) {
                targets[j] = existingTarget(keys.get(j));
            }
            writeRange(rows, targets, value);
        }
    }

    private void writeColumn(Object key, Object value) {
        if (value == Table.ABSENT) {
            table.removeColumn(index().position(key));
            return;
        }
        if (value instanceof Table source) {
            if (source.columnCount() != 1) {
                throw new ShapeMismatchException("Single column target needs a one-column table, got "
                        + source.columnCount() + " columns");
            }
            insertSingleColumn(key, source.column(0));
            return;
        }
        if (Columns.isVectorLike(value)) {
            insertSingleColumn(key, toColumn(value));
            return;
        }
        insertSingleColumn(key, broadcast(key, value));
    }

    private void writeColumns(List<Object> keys, Object value) {
        if (value == Table.ABSENT) {
            var positions = new int[keys.size()];
            for (int i = 0; i < positions.length; i++) {
                positions[i] = index().position(keys.get(i));
            }
            table.removeColumns(positions);
            return;
        }
        if (value instanceof Table source) {
            if (source.columnCount() != keys.size()) {
                throw new ShapeMismatchException("Table value has " + source.columnCount()
                        + " columns but " + keys.size() + " targets were selected");
            }
            for (int i = 0; i < keys.size(); i++) {
                insertSingleColumn(keys.get(i), source.column(i));
            }
            return;
        }
        if (Columns.isVectorLike(value)) {
            var column = toColumn(value);
            for (int i = 0; i < keys.size(); i++) {
                insertSingleColumn(keys.get(i), i == 0 ? column : column.copy());
            }
            return;
        }
        for (Object key : keys) {
            insertSingleColumn(key, broadcast(key, value));
        }
    }

    /**
     * {@code table[row, column] = value}; degrades to a length-1 column write on tables
     * with at most one row.
     */
    private void writeEntry(int row, Object key, Object value) {
        if (table.rowCount() <= 1) {
            insertSingleColumn(key, Columns.filled(value, 1, table.configuration().defaultColumnType()));
            return;
        }
        var column = table.columnAt(index().position(key));
        checkRow(row);
        writeCell(column, row, value);
    }

    private void writeRowAcrossColumns(int row, List<Object> keys, Object value) {
        if (value instanceof Table source) {
            if (source.columnCount() != keys.size()) {
                throw new ShapeMismatchException("Table value has " + source.columnCount()
                        + " columns but " + keys.size() + " targets were selected");
            }
            if (source.rowCount() != 1) {
                throw LengthMismatchException.of("row value", 1, source.rowCount());
            }
            if (table.rowCount() <= 1) {
                for (int j = 0; j < keys.size(); j++) {
                    writeEntry(row, keys.get(j), source.value(0, j));
                }
                return;
            }
            checkRow(row);
            for (int j = 0; j < keys.size(); j++) {
                writeCell(table.columnAt(existingTarget(keys.get(j))), row, source.value(0, j));
            }
            return;
        }
        Object scalar = value;
        if (Columns.isVectorLike(value)) {
            var column = toColumn(value);
            if (column.length() != 1) {
                throw LengthMismatchException.of("row value", 1, column.length());
            }
            scalar = column.get(0);
        }
        for (Object key : keys) {
            writeEntry(row, key, scalar);
        }
    }

    private void writeRange(RowSelection rows, int[] targets, Object value) {
        int[] positions = rows.toIntArray();
        if (value instanceof Table source) {
            if (source.columnCount() != targets.length) {
                throw new ShapeMismatchException("Table value has " + source.columnCount()
                        + " columns but " + targets.length + " targets were selected");
            }
            if (source.rowCount() != positions.length) {
                throw LengthMismatchException.of("table value rows", positions.length, source.rowCount());
            }
            for (int j = 0; j < targets.length; j++) {
                var column = table.columnAt(targets[j]);
                for (int i = 0; i < positions.length; i++) {
                    writeCell(column, positions[i], source.value(i, j));
                }
            }
            return;
        }
        if (Columns.isVectorLike(value)) {
            var values = toColumn(value);
            if (values.length() != positions.length) {
                throw LengthMismatchException.of("vector value", positions.length, values.length());
            }
            for (int target : targets) {
                var column = table.columnAt(target);
                for (int i = 0; i < positions.length; i++) {
                    writeCell(column, positions[i], values.get(i));
                }
            }
            return;
        }
        for (int target : targets) {
            var column = table.columnAt(target);
            for (int position : positions) {
                writeCell(column, position, value);
            }
        }
    }

    /**
     * The only place where a value that does not fit its column becomes NA.
     */
    private static void writeCell(Column<?> column, int row, Object value) {
        try {
            column.set(row, value);
        } catch (TypeMismatchException e) {
            logger.debug("Storing NA at row {}: {}", row, e.getMessage());
            column.setNa(row);
        }
    }

    /**
     * Replace the column {@code key} names, append it under a new name, or append it at
     * the next free position with a generated name.
     */
    private void insertSingleColumn(Object key, Column<?> column) {
        var index = index();
        int columnCount = table.columnCount();
        boolean exists = index.contains(key);
        boolean replacingOnlyColumn = exists && columnCount == 1;
        if (columnCount > 0 && !replacingOnlyColumn && column.length() != table.rowCount()) {
            throw LengthMismatchException.of("column '" + key + "'", table.rowCount(), column.length());
        }
        if (exists) {
            table.replaceColumn(index.position(key), column);
            return;
        }
        if (key instanceof String name) {
            table.appendColumn(name, column);
            return;
        }
        long position = ((Number) key).longValue();
        if (position == columnCount) {
            table.appendColumn(index.nextGeneratedName(table.configuration().generatedNamePrefix()), column);
        } else if (position > columnCount) {
            throw new NonContiguousInsertException("Cannot insert at position " + position
                    + "; next free position is " + columnCount);
        } else {
            throw UnknownColumnException.of(key);
        }
    }

    /**
     * Column of copies of {@code value} matching the current row count, or of length 1 when
     * the written column is, or will be, the only one.
     */
    private Column<?> broadcast(Object key, Object value) {
        int rows = table.rowCount();
        int columnCount = table.columnCount();
        boolean onlyColumn = columnCount == 0 || (columnCount == 1 && index().contains(key));
        if (onlyColumn) {
            rows = Math.max(rows, 1);
        }
        return Columns.filled(value, rows, table.configuration().defaultColumnType());
    }

    private Column<?> toColumn(Object vector) {
        return Columns.toColumn(vector, table.configuration().defaultColumnType());
    }

    // ===== RESOLUTION =====

    int[] resolveColumns(Selector selector) {
        var index = index();
        if (selector instanceof Selector.Name || selector instanceof Selector.Position) {
            return new int[]{index.position(singleKey(selector))};
        }
        if (selector instanceof Selector.Positions positions) {
            return Arrays.stream(positions.positions()).map(p -> index.position(p)).toArray();
        }
        if (selector instanceof Selector.Mask mask) {
            return index.positions(mask.mask());
        }
        if (selector instanceof Selector.Keys keys) {
            return index.positions(keys.keys());
        }
        return RowSelection.all(index.size()).toIntArray();
    }

    /**
     * Keys of a multi-column write; names and positions stay unresolved so new columns
     * can be appended.
     */
    private List<Object> columnKeys(Selector selector) {
        if (selector instanceof Selector.Keys keys) {
            return keys.keys();
        }
        if (selector instanceof Selector.Positions positions) {
            var keys = new ArrayList<Object>(positions.positions().length);
            for (int position : positions.positions()) {
                keys.add(position);
            }
            return keys;
        }
        if (selector instanceof Selector.Name || selector instanceof Selector.Position) {
            return List.of(singleKey(selector));
        }
        var keys = new ArrayList<Object>();
        for (int position : resolveColumns(selector)) {
            keys.add(position);
        }
        return keys;
    }

    private int existingTarget(Object key) {
        var index = index();
        if (!index.contains(key)) {
            throw new NonExistentTargetException("Cannot assign rows of non-existent column: " + key);
        }
        return index.position(key);
    }

    private static Object singleKey(Selector selector) {
        if (selector instanceof Selector.Name name) {
            return name.name();
        }
        if (selector instanceof Selector.Position position) {
            return position.position();
        }
        throw new IllegalArgumentException("Expected a single column key, got " + selector);
    }

    private static void requireNotAbsent(Object value) {
        if (value == Table.ABSENT) {
            throw new IllegalArgumentException("Only whole columns can be deleted");
        }
    }

    private void checkRow(int row) {
        if (row < 0 || row >= table.rowCount()) {
            throw OutOfBoundsException.of(row, table.rowCount());
        }
    }

    private ColumnIndex index() {
        return table.liveIndex();
    }
}
