package io.memframe.storage;

import io.memframe.core.ColumnType;

import java.util.BitSet;

/**
 * Fully dynamic column; the fallback when no common element type exists.
 * Integral numbers are widened to {@code Long} and floating point numbers
 * to {@code Double} so that equal values compare and hash alike.
 */
public final class ObjectColumn extends AbstractColumn<Object> {

    private final Object[] values;

    ObjectColumn(Object[] values, BitSet na) {
        super(values.length, na);
        this.values = values;
    }

    public static ObjectColumn of(Object... values) {
        var column = new ObjectColumn(new Object[values.length], allSet(values.length));
        for (int i = 0; i < values.length; i++) {
            column.set(i, values[i]);
        }
        return column;
    }

    @Override
    public ColumnType type() {
        return ColumnType.OBJECT;
    }

    @Override
    protected Object valueAt(int position) {
        return values[position];
    }

    @Override
    protected void store(int position, Object value) {
        values[position] = value;
    }

    @Override
    protected Object coerce(Object value) {
        if (Values.isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof Character c) {
            return c.toString();
        }
        return value;
    }

    @Override
    protected ObjectColumn allNa(int length) {
        return new ObjectColumn(new Object[length], allSet(length));
    }

    @Override
    public ObjectColumn copy() {
        return new ObjectColumn(values.clone(), (BitSet) na.clone());
    }
}
