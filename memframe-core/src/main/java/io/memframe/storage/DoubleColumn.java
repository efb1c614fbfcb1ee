package io.memframe.storage;

import io.memframe.core.ColumnType;
import io.memframe.core.TypeMismatchException;

import java.util.BitSet;

/**
 * Double precision column backed by a {@code double[]}. NaN is a value, not NA.
 */
public final class DoubleColumn extends AbstractColumn<Double> {

    private final double[] values;

    DoubleColumn(double[] values, BitSet na) {
        super(values.length, na);
        this.values = values;
    }

    public static DoubleColumn of(double... values) {
        return new DoubleColumn(values.clone(), new BitSet(values.length));
    }

    /**
     * Primitive read; returns NaN for NA cells.
     */
    public double getDouble(int position) {
        checkPosition(position);
        return na.get(position) ? Double.NaN : values[position];
    }

    @Override
    public ColumnType type() {
        return ColumnType.DOUBLE;
    }

    @Override
    protected Double valueAt(int position) {
        return values[position];
    }

    @Override
    protected void store(int position, Double value) {
        values[position] = value;
    }

    @Override
    protected Double coerce(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        throw TypeMismatchException.of(value, ColumnType.DOUBLE);
    }

    @Override
    protected DoubleColumn allNa(int length) {
        return new DoubleColumn(new double[length], allSet(length));
    }

    @Override
    public DoubleColumn copy() {
        return new DoubleColumn(values.clone(), (BitSet) na.clone());
    }
}
