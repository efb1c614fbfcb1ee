package io.memframe.table;

import io.memframe.core.ColumnType;
import io.memframe.core.LengthMismatchException;
import io.memframe.core.MemframeConfiguration;
import io.memframe.kernel.ColumnIndex;
import io.memframe.kernel.Table;
import io.memframe.storage.Column;
import io.memframe.storage.Columns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Vertical (row-wise) and horizontal (column-wise) combination of tables.
 * Results always own their storage.
 */
public final class Concatenation {

    private static final Logger logger = LoggerFactory.getLogger(Concatenation.class);

    private Concatenation() {
    }

    public static DataTable vertical(Table... tables) {
        return vertical(Arrays.asList(tables));
    }

    /**
     * Union of all column names in first-seen order; rows of each table in turn. A table
     * without some column contributes NA rows of the column's promoted type.
     */
    public static DataTable vertical(List<? extends Table> tables) {
        if (tables.isEmpty()) {
            return DataTable.empty();
        }
        var names = new LinkedHashSet<String>();
        for (Table table : tables) {
            names.addAll(table.names());
        }
        var columns = new ArrayList<Column<?>>(names.size());
        for (String name : names) {
            columns.add(verticalColumn(name, tables));
        }
        return new DataTable(columns, new ColumnIndex(names), tables.get(0).configuration());
    }

    private static Column<?> verticalColumn(String name, List<? extends Table> tables) {
        var present = new ArrayList<Column<?>>(tables.size());
        ColumnType type = null;
        for (Table table : tables) {
            if (table.containsColumn(name)) {
                var column = table.column(name);
                present.add(column);
                type = ColumnType.promote(type, column.type());
            }
        }
        if (type == ColumnType.OBJECT && present.stream().anyMatch(c -> c.type() != ColumnType.OBJECT)) {
            logger.debug("Column '{}' has no common element type, storing as OBJECT", name);
        }
        var parts = new ArrayList<Column<?>>(tables.size());
        int next = 0;
        for (Table table : tables) {
            parts.add(table.containsColumn(name) ? present.get(next++) : Columns.allNa(type, table.rowCount()));
        }
        return Columns.concat(parts, type);
    }

    public static DataTable horizontal(Object... parts) {
        return horizontal(Arrays.asList(parts));
    }

    /**
     * Columns of each part side by side. A part is a table, a vector (one column) or a
     * scalar (one column of the common row count). Vectors and scalars get generated
     * names; duplicated names are suffixed.
     *
     * @throws LengthMismatchException if tables or vectors disagree in row count
     */
    public static DataTable horizontal(List<?> parts) {
        var configuration = configurationOf(parts);
        int rows = commonRowCount(parts);
        var columns = new ArrayList<Column<?>>();
        var names = new ArrayList<String>();
        for (Object part : parts) {
            if (part instanceof Table table) {
                for (int j = 0; j < table.columnCount(); j++) {
                    columns.add(table.column(j).copy());
                    names.add(table.index().name(j));
                }
            } else if (Columns.isVectorLike(part)) {
                columns.add(Columns.toColumn(part, configuration.defaultColumnType()).copy());
                names.add(configuration.generatedName(names.size()));
            } else {
                columns.add(Columns.filled(part, rows, configuration.defaultColumnType()));
                names.add(configuration.generatedName(names.size()));
            }
        }
        var unique = ColumnIndex.makeUnique(names, configuration.uniqueNameSeparator());
        return new DataTable(columns, new ColumnIndex(unique), configuration);
    }

    private static int commonRowCount(List<?> parts) {
        int rows = -1;
        for (Object part : parts) {
            int length;
            if (part instanceof Table table) {
                if (table.columnCount() == 0) {
                    continue;
                }
                length = table.rowCount();
            } else if (Columns.isVectorLike(part)) {
                length = Columns.toColumn(part, ColumnType.OBJECT).length();
            } else {
                continue;
            }
            if (rows < 0) {
                rows = length;
            } else if (rows != length) {
                throw LengthMismatchException.of("concatenated rows", rows, length);
            }
        }
        return rows < 0 ? 1 : rows;
    }

    private static MemframeConfiguration configurationOf(List<?> parts) {
        for (Object part : parts) {
            if (part instanceof Table table) {
                return table.configuration();
            }
        }
        return MemframeConfiguration.defaults();
    }
}
