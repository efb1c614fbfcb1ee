package io.memframe.storage;

import io.memframe.core.ColumnType;
import io.memframe.core.Ternary;

import java.util.List;

/**
 * Homogeneously typed, NA-capable sequence of values.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Positions are 0-based and fixed at construction; a column never grows or shrinks.</li>
 *   <li>{@code null} is NA, on both the read and the write side.</li>
 *   <li>{@link #set} coerces the value to {@link #type()} or throws
 *       {@link io.memframe.core.TypeMismatchException}; the cell is left unchanged on failure.</li>
 *   <li>{@link #gather} and {@link #copy} return columns with independent storage.</li>
 *   <li>{@link #equals}/{@link #hashCode} are content based and follow {@link #isEquivalent}.</li>
 * </ul>
 * <p>
 * <b>Thread-safety:</b> none. Columns are mutable and shared by reference between
 * shallow table copies and views; external synchronization is required when a
 * column is reachable from more than one thread.
 *
 * @param <T> boxed element type
 */
public sealed interface Column<T> extends Iterable<T> permits AbstractColumn {

    ColumnType type();

    int length();

    /**
     * @return the value at {@code position}, or {@code null} for NA
     */
    T get(int position);

    boolean isNa(int position);

    int naCount();

    /**
     * Store {@code value} at {@code position}; {@code null} stores NA.
     */
    void set(int position, Object value);

    void setNa(int position);

    /**
     * New column holding the values at {@code positions}, in that order.
     */
    Column<T> gather(int[] positions);

    /**
     * Write {@code values[i]} to {@code positions[i]} for every {@code i}.
     */
    void scatter(int[] positions, Column<?> values);

    /**
     * Write the same value to every position in {@code positions}.
     */
    void fill(int[] positions, Object value);

    Column<T> copy();

    /**
     * Same values stored as another element type.
     *
     * @return this column when it already has {@code target} type, otherwise a converted copy
     */
    Column<?> convertTo(ColumnType target);

    /**
     * Element-wise comparison; any NA operand yields {@link Ternary#UNKNOWN} at that position.
     */
    Ternary[] compareElements(Column<?> other);

    /**
     * Whole-column {@code ==}: FALSE on a length mismatch or any definitely unequal pair,
     * otherwise UNKNOWN when any pair involves NA, otherwise TRUE.
     */
    Ternary equalTo(Column<?> other);

    /**
     * Identity-style equality where NA equals NA and never equals a value.
     */
    boolean isEquivalent(Column<?> other);

    List<T> toList();
}
