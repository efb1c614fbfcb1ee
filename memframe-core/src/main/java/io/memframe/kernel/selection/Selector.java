package io.memframe.kernel.selection;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A raw addressing argument classified by kind.
 * <p>
 * {@link #classify} is the single place that inspects raw arguments; everything
 * downstream switches over these variants.
 */
public sealed interface Selector permits Selector.Name, Selector.Position, Selector.Positions,
        Selector.Mask, Selector.Keys, Selector.All {

    /**
     * Every row, or every column, in order.
     */
    Selector ALL = All.INSTANCE;

    /**
     * Whether the selector addresses exactly one row or column by itself.
     */
    default boolean isSingle() {
        return this instanceof Name || this instanceof Position;
    }

    record Name(String name) implements Selector {
        public Name {
            if (name == null) {
                throw new IllegalArgumentException("name required");
            }
        }
    }

    record Position(int position) implements Selector {
    }

    record Positions(int[] positions) implements Selector {
        public Positions {
            if (positions == null) {
                throw new IllegalArgumentException("positions required");
            }
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Positions other && Arrays.equals(positions, other.positions);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(positions);
        }

        @Override
        public String toString() {
            return "Positions" + Arrays.toString(positions);
        }
    }

    record Mask(boolean[] mask) implements Selector {
        public Mask {
            if (mask == null) {
                throw new IllegalArgumentException("mask required");
            }
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Mask other && Arrays.equals(mask, other.mask);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(mask);
        }

        @Override
        public String toString() {
            return "Mask" + Arrays.toString(mask);
        }
    }

    /**
     * Column names, possibly mixed with positions.
     */
    record Keys(List<Object> keys) implements Selector {
        public Keys {
            if (keys == null) {
                throw new IllegalArgumentException("keys required");
            }
            keys = Collections.unmodifiableList(new ArrayList<>(keys));
        }
    }

    enum All implements Selector {
        INSTANCE
    }

    /**
     * Classify a raw argument.
     * <ul>
     *   <li>{@code String}: {@link Name}</li>
     *   <li>{@code Integer}, {@code Long}, {@code Short}, {@code Byte}: {@link Position}</li>
     *   <li>{@code int[]}, {@code long[]}, sequence of integral numbers: {@link Positions}</li>
     *   <li>{@code boolean[]}, sequence of booleans: {@link Mask}</li>
     *   <li>any other sequence ({@code String[]}, list of names): {@link Keys}</li>
     *   <li>a {@code Selector}: itself</li>
     * </ul>
     *
     * @throws IllegalArgumentException for {@code null} or unsupported argument types
     */
    static Selector classify(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("selector required");
        }
        if (raw instanceof Selector selector) {
            return selector;
        }
        if (raw instanceof String name) {
            return new Name(name);
        }
        if (isIntegral(raw)) {
            long position = ((Number) raw).longValue();
            if (position < Integer.MIN_VALUE || position > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("position out of int range: " + position);
            }
            return new Position((int) position);
        }
        if (raw instanceof int[] positions) {
            return new Positions(positions.clone());
        }
        if (raw instanceof long[] positions) {
            return new Positions(Arrays.stream(positions).mapToInt(Math::toIntExact).toArray());
        }
        if (raw instanceof boolean[] mask) {
            return new Mask(mask.clone());
        }
        if (raw instanceof Collection<?> collection) {
            return classifySequence(new ArrayList<Object>(collection));
        }
        if (raw.getClass().isArray() && !raw.getClass().getComponentType().isPrimitive()) {
            int length = Array.getLength(raw);
            var values = new ArrayList<Object>(length);
            for (int i = 0; i < length; i++) {
                values.add(Array.get(raw, i));
            }
            return classifySequence(values);
        }
        throw new IllegalArgumentException("Unsupported selector type: " + raw.getClass().getName());
    }

    private static Selector classifySequence(List<Object> values) {
        if (values.isEmpty()) {
            return new Positions(new int[0]);
        }
        if (values.stream().allMatch(v -> v instanceof Boolean)) {
            var mask = new boolean[values.size()];
            for (int i = 0; i < mask.length; i++) {
                mask[i] = (Boolean) values.get(i);
            }
            return new Mask(mask);
        }
        if (values.stream().allMatch(Selector::isIntegral)) {
            return new Positions(values.stream().mapToInt(v -> Math.toIntExact(((Number) v).longValue())).toArray());
        }
        for (Object value : values) {
            if (!(value instanceof String) && !isIntegral(value)) {
                throw new IllegalArgumentException("Unsupported key in selector: " + value);
            }
        }
        return new Keys(values);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte;
    }
}
