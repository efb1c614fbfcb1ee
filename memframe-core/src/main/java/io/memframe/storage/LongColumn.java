package io.memframe.storage;

import io.memframe.core.ColumnType;
import io.memframe.core.TypeMismatchException;

import java.util.BitSet;

/**
 * 64-bit integer column backed by a {@code long[]}.
 * <p>
 * Accepts any integral number, booleans (as 0/1) and floating point values
 * without a fractional part.
 */
public final class LongColumn extends AbstractColumn<Long> {

    private final long[] values;

    LongColumn(long[] values, BitSet na) {
        super(values.length, na);
        this.values = values;
    }

    public static LongColumn of(long... values) {
        return new LongColumn(values.clone(), new BitSet(values.length));
    }

    /**
     * Primitive read; returns 0 for NA cells.
     */
    public long getLong(int position) {
        checkPosition(position);
        return na.get(position) ? 0L : values[position];
    }

    @Override
    public ColumnType type() {
        return ColumnType.LONG;
    }

    @Override
    protected Long valueAt(int position) {
        return values[position];
    }

    @Override
    protected void store(int position, Long value) {
        values[position] = value;
    }

    @Override
    protected Long coerce(Object value) {
        if (Values.isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Values.fitsLong(d)) {
                return (long) d;
            }
        }
        throw TypeMismatchException.of(value, ColumnType.LONG);
    }

    @Override
    protected LongColumn allNa(int length) {
        return new LongColumn(new long[length], allSet(length));
    }

    @Override
    public LongColumn copy() {
        return new LongColumn(values.clone(), (BitSet) na.clone());
    }
}
