package io.memframe.storage;

import io.memframe.core.ColumnType;
import io.memframe.core.TypeMismatchException;

import java.util.BitSet;

public final class BooleanColumn extends AbstractColumn<Boolean> {

    private final BitSet values;

    BooleanColumn(int length, BitSet values, BitSet na) {
        super(length, na);
        this.values = values;
    }

    public static BooleanColumn of(boolean... values) {
        var bits = new BitSet(values.length);
        for (int i = 0; i < values.length; i++) {
            bits.set(i, values[i]);
        }
        return new BooleanColumn(values.length, bits, new BitSet(values.length));
    }

    @Override
    public ColumnType type() {
        return ColumnType.BOOLEAN;
    }

    @Override
    protected Boolean valueAt(int position) {
        return values.get(position);
    }

    @Override
    protected void store(int position, Boolean value) {
        values.set(position, value);
    }

    @Override
    protected Boolean coerce(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw TypeMismatchException.of(value, ColumnType.BOOLEAN);
    }

    @Override
    protected BooleanColumn allNa(int length) {
        return new BooleanColumn(length, new BitSet(length), allSet(length));
    }

    @Override
    public BooleanColumn copy() {
        return new BooleanColumn(length, (BitSet) values.clone(), (BitSet) na.clone());
    }
}
