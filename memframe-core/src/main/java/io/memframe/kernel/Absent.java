package io.memframe.kernel;

/**
 * Deletion marker: assigning it to a single column removes that column.
 * Distinct from {@code null}, which is the NA scalar.
 */
public enum Absent {
    INSTANCE
}
