package io.memframe.kernel;

import io.memframe.storage.Values;

import java.util.Arrays;

/**
 * Hashable tuple of one row's values.
 * <p>
 * Equality follows identity-style NA handling: NA equals NA, numbers compare by
 * value across boxed types. Works for rows of mixed element types.
 */
public final class RowKey {

    private final Object[] values;
    private final int hash;

    private RowKey(Object[] values) {
        this.values = values;
        int h = values.length;
        for (Object value : values) {
            h = Values.mix(h, Values.hash(value));
        }
        this.hash = h;
    }

    public static RowKey of(Object[] values) {
        return new RowKey(values.clone());
    }

    public static RowKey of(Table table, int row) {
        return new RowKey(table.rowValues(row));
    }

    public int size() {
        return values.length;
    }

    public Object get(int index) {
        return values[index];
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RowKey other)) {
            return false;
        }
        if (hash != other.hash || values.length != other.values.length) {
            return false;
        }
        for (int i = 0; i < values.length; i++) {
            if (!Values.equivalent(values[i], other.values[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "RowKey" + Arrays.toString(values);
    }
}
