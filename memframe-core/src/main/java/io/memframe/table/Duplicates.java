package io.memframe.table;

import io.memframe.kernel.RowKey;
import io.memframe.kernel.Table;

import java.util.HashSet;

/**
 * Duplicate-row detection over hashed {@link RowKey}s. NA cells match NA cells.
 */
final class Duplicates {

    private Duplicates() {
    }

    /**
     * {@code true} for every row equal to an earlier row.
     */
    static boolean[] duplicated(Table table) {
        var seen = new HashSet<RowKey>(Math.max(16, table.rowCount() * 2));
        var result = new boolean[table.rowCount()];
        for (int row = 0; row < result.length; row++) {
            result[row] = !seen.add(RowKey.of(table, row));
        }
        return result;
    }

    /**
     * {@code true} for the first occurrence of every distinct row.
     */
    static boolean[] firstOccurrences(Table table) {
        var result = duplicated(table);
        for (int row = 0; row < result.length; row++) {
            result[row] = !result[row];
        }
        return result;
    }
}
