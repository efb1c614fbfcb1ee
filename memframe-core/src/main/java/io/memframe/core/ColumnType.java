package io.memframe.core;

/**
 * Closed set of column element kinds.
 * <p>
 * Every column stores exactly one of these kinds. {@link #OBJECT} is the fully
 * dynamic fallback and the only kind that accepts arbitrary values; the other
 * kinds are backed by primitive or {@code String} arrays.
 * <p>
 * Promotion resolves the least upper bound of two kinds:
 * <pre>
 *            BOOLEAN  LONG    DOUBLE  STRING  OBJECT
 * BOOLEAN    BOOLEAN  LONG    DOUBLE  OBJECT  OBJECT
 * LONG       LONG     LONG    DOUBLE  OBJECT  OBJECT
 * DOUBLE     DOUBLE   DOUBLE  DOUBLE  OBJECT  OBJECT
 * STRING     OBJECT   OBJECT  OBJECT  STRING  OBJECT
 * OBJECT     OBJECT   OBJECT  OBJECT  OBJECT  OBJECT
 * </pre>
 */
public enum ColumnType {
    BOOLEAN(Boolean.class),
    LONG(Long.class),
    DOUBLE(Double.class),
    STRING(String.class),
    OBJECT(Object.class);

    private static final ColumnType[][] PROMOTION = {
            // BOOLEAN, LONG, DOUBLE, STRING, OBJECT
            {BOOLEAN, LONG, DOUBLE, OBJECT, OBJECT},
            {LONG, LONG, DOUBLE, OBJECT, OBJECT},
            {DOUBLE, DOUBLE, DOUBLE, OBJECT, OBJECT},
            {OBJECT, OBJECT, OBJECT, STRING, OBJECT},
            {OBJECT, OBJECT, OBJECT, OBJECT, OBJECT}
    };

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) {
        this.javaType = javaType;
    }

    /**
     * Boxed Java type of the values a column of this kind returns.
     */
    public Class<?> javaType() {
        return javaType;
    }

    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }

    /**
     * Least upper bound of this kind and {@code other}.
     */
    public ColumnType promote(ColumnType other) {
        if (other == null) {
            throw new IllegalArgumentException("other required");
        }
        return PROMOTION[ordinal()][other.ordinal()];
    }

    /**
     * Null-tolerant promotion where {@code null} stands for "no type seen yet".
     *
     * @return the least upper bound, or {@code null} if both are {@code null}
     */
    public static ColumnType promote(ColumnType left, ColumnType right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return left.promote(right);
    }

    /**
     * Element kind of a non-NA value.
     *
     * @throws IllegalArgumentException if {@code value} is {@code null} (NA has no kind)
     */
    public static ColumnType forValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("NA has no element type");
        }
        return forClass(value.getClass());
    }

    /**
     * Element kind for a Java class. Integral types map to {@link #LONG},
     * floating point types to {@link #DOUBLE}, characters to {@link #STRING};
     * anything unknown maps to {@link #OBJECT}.
     */
    public static ColumnType forClass(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        if (type == boolean.class || type == Boolean.class) {
            return BOOLEAN;
        }
        if (type == long.class || type == Long.class
                || type == int.class || type == Integer.class
                || type == short.class || type == Short.class
                || type == byte.class || type == Byte.class) {
            return LONG;
        }
        if (type == double.class || type == Double.class
                || type == float.class || type == Float.class) {
            return DOUBLE;
        }
        if (type == String.class || type == char.class || type == Character.class) {
            return STRING;
        }
        return OBJECT;
    }
}
