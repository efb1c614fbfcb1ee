package io.memframe.storage;

import io.memframe.core.ColumnType;
import io.memframe.core.TypeMismatchException;

import java.util.BitSet;

/**
 * Text column. Characters are stored as one-character strings.
 */
public final class StringColumn extends AbstractColumn<String> {

    private final String[] values;

    StringColumn(String[] values, BitSet na) {
        super(values.length, na);
        this.values = values;
    }

    /**
     * Column of the given strings; {@code null} entries become NA.
     */
    public static StringColumn of(String... values) {
        var na = new BitSet(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                na.set(i);
            }
        }
        return new StringColumn(values.clone(), na);
    }

    @Override
    public ColumnType type() {
        return ColumnType.STRING;
    }

    @Override
    protected String valueAt(int position) {
        return values[position];
    }

    @Override
    protected void store(int position, String value) {
        values[position] = value;
    }

    @Override
    protected String coerce(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Character c) {
            return c.toString();
        }
        throw TypeMismatchException.of(value, ColumnType.STRING);
    }

    @Override
    protected StringColumn allNa(int length) {
        return new StringColumn(new String[length], allSet(length));
    }

    @Override
    public StringColumn copy() {
        return new StringColumn(values.clone(), (BitSet) na.clone());
    }
}
