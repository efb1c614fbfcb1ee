package io.memframe.table;

import io.memframe.core.Ternary;
import io.memframe.kernel.Table;
import io.memframe.storage.Values;

/**
 * Table-level {@code ==}, identity-style equivalence and hashing, built from the
 * column comparisons.
 */
final class TableComparisons {

    private TableComparisons() {
    }

    /**
     * FALSE when the shapes or names differ or any cell pair differs; otherwise UNKNOWN
     * if any compared cell is NA, TRUE if none is.
     */
    static Ternary equalTo(Table left, Table right) {
        if (!sameLayout(left, right)) {
            return Ternary.FALSE;
        }
        var outcome = Ternary.TRUE;
        for (int j = 0; j < left.columnCount(); j++) {
            outcome = outcome.and(left.column(j).equalTo(right.column(j)));
            if (outcome == Ternary.FALSE) {
                return Ternary.FALSE;
            }
        }
        return outcome;
    }

    static boolean isEquivalent(Table left, Table right) {
        if (left == right) {
            return true;
        }
        if (!sameLayout(left, right)) {
            return false;
        }
        for (int j = 0; j < left.columnCount(); j++) {
            if (!left.column(j).isEquivalent(right.column(j))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Shape-derived seed mixed with each column's hash in column order.
     */
    static int hash(Table table) {
        int h = 31 * Integer.hashCode(table.rowCount()) + Integer.hashCode(table.columnCount()) + 1;
        for (int j = 0; j < table.columnCount(); j++) {
            h = Values.mix(h, table.column(j).hashCode());
        }
        return h;
    }

    private static boolean sameLayout(Table left, Table right) {
        return left.columnCount() == right.columnCount()
                && left.rowCount() == right.rowCount()
                && left.names().equals(right.names());
    }
}
