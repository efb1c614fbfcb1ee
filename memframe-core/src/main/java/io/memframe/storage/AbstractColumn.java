package io.memframe.storage;

import io.memframe.core.ColumnType;
import io.memframe.core.LengthMismatchException;
import io.memframe.core.Ternary;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Shared storage logic: a fixed length and an NA bitmap (set bit = NA).
 * <p>
 * Subclasses own the value array and implement element coercion; everything
 * positional (bounds, gather, scatter, comparison) lives here.
 */
public abstract sealed class AbstractColumn<T> implements Column<T>
        permits LongColumn, DoubleColumn, BooleanColumn, StringColumn, ObjectColumn {

    protected final int length;
    protected final BitSet na;

    protected AbstractColumn(int length, BitSet na) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        this.length = length;
        this.na = na;
    }

    /**
     * Raw value of a non-NA cell.
     */
    protected abstract T valueAt(int position);

    /**
     * Store an already coerced value, leaving the NA bit untouched.
     */
    protected abstract void store(int position, T value);

    /**
     * Convert an arbitrary non-null value to the element type.
     *
     * @throws io.memframe.core.TypeMismatchException if the value is not representable
     */
    protected abstract T coerce(Object value);

    /**
     * New all-NA column of the same kind.
     */
    protected abstract AbstractColumn<T> allNa(int length);

    @Override
    public int length() {
        return length;
    }

    @Override
    public T get(int position) {
        checkPosition(position);
        return na.get(position) ? null : valueAt(position);
    }

    @Override
    public boolean isNa(int position) {
        checkPosition(position);
        return na.get(position);
    }

    @Override
    public int naCount() {
        return na.cardinality();
    }

    @Override
    public void set(int position, Object value) {
        checkPosition(position);
        if (value == null) {
            na.set(position);
            return;
        }
        store(position, coerce(value));
        na.clear(position);
    }

    @Override
    public void setNa(int position) {
        checkPosition(position);
        na.set(position);
    }

    @Override
    public Column<T> gather(int[] positions) {
        var result = allNa(positions.length);
        for (int i = 0; i < positions.length; i++) {
            int source = positions[i];
            checkPosition(source);
            if (!na.get(source)) {
                result.store(i, valueAt(source));
                result.na.clear(i);
            }
        }
        return result;
    }

    @Override
    public void scatter(int[] positions, Column<?> values) {
        if (positions.length != values.length()) {
            throw LengthMismatchException.of("scatter values", positions.length, values.length());
        }
        for (int i = 0; i < positions.length; i++) {
            set(positions[i], values.get(i));
        }
    }

    @Override
    public void fill(int[] positions, Object value) {
        if (value == null) {
            for (int position : positions) {
                setNa(position);
            }
            return;
        }
        T coerced = coerce(value);
        for (int position : positions) {
            checkPosition(position);
            store(position, coerced);
            na.clear(position);
        }
    }

    @Override
    public Column<?> convertTo(ColumnType target) {
        if (target == type()) {
            return this;
        }
        var result = Columns.allNa(target, length);
        for (int i = 0; i < length; i++) {
            if (!na.get(i)) {
                result.set(i, valueAt(i));
            }
        }
        return result;
    }

    @Override
    public Ternary[] compareElements(Column<?> other) {
        if (other.length() != length) {
            throw LengthMismatchException.of("compared column", length, other.length());
        }
        var result = new Ternary[length];
        for (int i = 0; i < length; i++) {
            result[i] = Values.equal(get(i), other.get(i));
        }
        return result;
    }

    @Override
    public Ternary equalTo(Column<?> other) {
        if (other.length() != length) {
            return Ternary.FALSE;
        }
        var outcome = Ternary.TRUE;
        for (int i = 0; i < length; i++) {
            outcome = outcome.and(Values.equal(get(i), other.get(i)));
            if (outcome == Ternary.FALSE) {
                return Ternary.FALSE;
            }
        }
        return outcome;
    }

    @Override
    public boolean isEquivalent(Column<?> other) {
        if (other == this) {
            return true;
        }
        if (other == null || other.length() != length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (!Values.equivalent(get(i), other.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<T> toList() {
        var values = new ArrayList<T>(length);
        for (int i = 0; i < length; i++) {
            values.add(get(i));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < length;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(index++);
            }
        };
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Column<?> other && isEquivalent(other);
    }

    @Override
    public int hashCode() {
        int h = Integer.hashCode(length);
        for (int i = 0; i < length; i++) {
            h = Values.mix(h, Values.hash(get(i)));
        }
        return h;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(type().name()).append('[');
        for (int i = 0; i < length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(na.get(i) ? "NA" : valueAt(i));
        }
        return sb.append(']').toString();
    }

    protected final void checkPosition(int position) {
        if (position < 0 || position >= length) {
            throw new IndexOutOfBoundsException("position out of range: " + position + " (length " + length + ")");
        }
    }

    protected static BitSet allSet(int length) {
        var bits = new BitSet(length);
        bits.set(0, length);
        return bits;
    }
}
