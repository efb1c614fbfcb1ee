package io.memframe.storage;

import io.memframe.core.ColumnType;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Factories for columns: all-NA, broadcast, from values and concatenation.
 */
public final class Columns {

    private Columns() {
    }

    /**
     * All-NA column of the given type and length.
     */
    public static Column<?> allNa(ColumnType type, int length) {
        Objects.requireNonNull(type, "type");
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        var na = AbstractColumn.allSet(length);
        return switch (type) {
            case BOOLEAN -> new BooleanColumn(length, new BitSet(length), na);
            case LONG -> new LongColumn(new long[length], na);
            case DOUBLE -> new DoubleColumn(new double[length], na);
            case STRING -> new StringColumn(new String[length], na);
            case OBJECT -> new ObjectColumn(new Object[length], na);
        };
    }

    /**
     * Column of {@code length} copies of {@code value}.
     *
     * @param naType element type used when {@code value} is NA
     */
    public static Column<?> filled(Object value, int length, ColumnType naType) {
        if (value == null) {
            return allNa(naType, length);
        }
        var column = allNa(ColumnType.forValue(value), length);
        for (int i = 0; i < length; i++) {
            column.set(i, value);
        }
        return column;
    }

    public static LongColumn ofLongs(long... values) {
        return LongColumn.of(values);
    }

    public static LongColumn ofInts(int... values) {
        return LongColumn.of(Arrays.stream(values).asLongStream().toArray());
    }

    public static DoubleColumn ofDoubles(double... values) {
        return DoubleColumn.of(values);
    }

    public static BooleanColumn ofBooleans(boolean... values) {
        return BooleanColumn.of(values);
    }

    public static StringColumn ofStrings(String... values) {
        return StringColumn.of(values);
    }

    /**
     * Column typed by the promotion of all non-NA values; {@code null} entries are NA.
     * Uses {@code OBJECT} when every value is NA.
     */
    public static Column<?> of(Object... values) {
        return fromValues(Arrays.asList(values), ColumnType.OBJECT);
    }

    /**
     * Column typed by the promotion of all non-NA values.
     *
     * @param naType element type used when every value is NA
     */
    public static Column<?> fromValues(Collection<?> values, ColumnType naType) {
        ColumnType type = inferType(values);
        var column = allNa(type == null ? naType : type, values.size());
        int i = 0;
        for (Object value : values) {
            column.set(i++, value);
        }
        return column;
    }

    /**
     * Least upper bound of the element types of all non-NA values.
     *
     * @return the promoted type, or {@code null} if every value is NA
     */
    public static ColumnType inferType(Iterable<?> values) {
        ColumnType type = null;
        for (Object value : values) {
            if (value != null) {
                type = ColumnType.promote(type, ColumnType.forValue(value));
            }
        }
        return type;
    }

    /**
     * Whether {@code value} is a sequence that can be turned into a column:
     * a column, a list or an array.
     */
    public static boolean isVectorLike(Object value) {
        return value instanceof Column<?>
                || value instanceof List<?>
                || (value != null && value.getClass().isArray());
    }

    /**
     * Column view of a vector-like value. Columns are returned as is; lists and
     * arrays are copied into a new column.
     *
     * @throws IllegalArgumentException if the value is not vector-like
     */
    public static Column<?> toColumn(Object vector, ColumnType naType) {
        if (vector instanceof Column<?> column) {
            return column;
        }
        if (vector instanceof List<?> list) {
            return fromValues(list, naType);
        }
        if (vector instanceof long[] longs) {
            return LongColumn.of(longs);
        }
        if (vector instanceof int[] ints) {
            return ofInts(ints);
        }
        if (vector instanceof double[] doubles) {
            return DoubleColumn.of(doubles);
        }
        if (vector instanceof boolean[] booleans) {
            return BooleanColumn.of(booleans);
        }
        if (vector != null && vector.getClass().isArray()) {
            int length = Array.getLength(vector);
            var values = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                values.add(Array.get(vector, i));
            }
            return fromValues(values, naType);
        }
        throw new IllegalArgumentException("Not a vector: " + (vector == null ? "null" : vector.getClass().getName()));
    }

    /**
     * Append columns end to end, storing every value as {@code type}.
     */
    public static Column<?> concat(List<? extends Column<?>> parts, ColumnType type) {
        int total = 0;
        for (Column<?> part : parts) {
            total += part.length();
        }
        var result = allNa(type, total);
        int offset = 0;
        for (Column<?> part : parts) {
            for (int i = 0; i < part.length(); i++) {
                if (!part.isNa(i)) {
                    result.set(offset + i, part.get(i));
                }
            }
            offset += part.length();
        }
        return result;
    }

    /**
     * Append columns end to end under the promotion of their element types.
     */
    public static Column<?> concat(List<? extends Column<?>> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("parts must not be empty");
        }
        ColumnType type = null;
        for (Column<?> part : parts) {
            type = ColumnType.promote(type, part.type());
        }
        return concat(parts, type);
    }
}
