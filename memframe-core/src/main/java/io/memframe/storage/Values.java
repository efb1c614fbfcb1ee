package io.memframe.storage;

import io.memframe.core.Ternary;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * NA-aware scalar comparison and hashing shared by columns and row keys.
 * <p>
 * Numbers compare by value across boxed types, so {@code 1L} and {@code 1.0}
 * are equal under both operators. Hashing agrees with {@link #equivalent}.
 */
public final class Values {

    private static final int NA_HASH = 0x6e61_6e61;
    private static final double TWO_POW_63 = 0x1p63;

    private Values() {
    }

    /**
     * {@code ==}: UNKNOWN when either side is NA, NaN never equals NaN.
     */
    public static Ternary equal(Object left, Object right) {
        if (left == null || right == null) {
            return Ternary.UNKNOWN;
        }
        if (isPlainNumber(left) && isPlainNumber(right)) {
            return Ternary.of(sameNumber((Number) left, (Number) right));
        }
        return Ternary.of(left.equals(right));
    }

    /**
     * Identity-style equality: NA equals NA, NaN equals NaN, {@code 0.0} differs from {@code -0.0}.
     */
    public static boolean equivalent(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (isPlainNumber(left) && isPlainNumber(right)) {
            if (isIntegral(left) != isIntegral(right) && isNegativeZero((Number) left, (Number) right)) {
                return false;
            }
            if (isIntegral(left) || isIntegral(right)) {
                return sameNumber((Number) left, (Number) right);
            }
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue()) == 0;
        }
        return left.equals(right);
    }

    /**
     * Hash consistent with {@link #equivalent}.
     */
    public static int hash(Object value) {
        if (value == null) {
            return NA_HASH;
        }
        if (isPlainNumber(value)) {
            if (isIntegral(value)) {
                return Long.hashCode(((Number) value).longValue());
            }
            double d = ((Number) value).doubleValue();
            // Integral doubles hash like the equal long
            if (fitsLong(d) && !isNegativeZero(d)) {
                return Long.hashCode((long) d);
            }
            return Double.hashCode(d);
        }
        return value.hashCode();
    }

    /**
     * Order-sensitive bit mix of a running hash with the next component.
     */
    public static int mix(int hash, int component) {
        int k = component * 0xcc9e2d51;
        k = Integer.rotateLeft(k, 15);
        k *= 0x1b873593;
        int h = hash ^ k;
        h = Integer.rotateLeft(h, 13);
        return h * 5 + 0xe6546b64;
    }

    /**
     * Whether {@code d} is a whole number that a {@code long} holds exactly.
     */
    static boolean fitsLong(double d) {
        return d >= -TWO_POW_63 && d < TWO_POW_63 && Math.floor(d) == d;
    }

    // Mixed long/double pairs compare exactly, never through a rounded double
    private static boolean sameNumber(Number left, Number right) {
        boolean leftIntegral = isIntegral(left);
        boolean rightIntegral = isIntegral(right);
        if (leftIntegral && rightIntegral) {
            return left.longValue() == right.longValue();
        }
        if (leftIntegral) {
            return sameNumber(left.longValue(), right.doubleValue());
        }
        if (rightIntegral) {
            return sameNumber(right.longValue(), left.doubleValue());
        }
        return left.doubleValue() == right.doubleValue();
    }

    private static boolean sameNumber(long l, double d) {
        return fitsLong(d) && (long) d == l;
    }

    private static boolean isNegativeZero(Number left, Number right) {
        return isNegativeZero(left.doubleValue()) || isNegativeZero(right.doubleValue());
    }

    private static boolean isNegativeZero(double d) {
        return d == 0.0 && 1.0 / d < 0;
    }

    static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte;
    }

    private static boolean isPlainNumber(Object value) {
        return value instanceof Number
                && !(value instanceof BigDecimal)
                && !(value instanceof BigInteger);
    }
}
