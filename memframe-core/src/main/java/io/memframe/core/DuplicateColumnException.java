package io.memframe.core;

/**
 * A column name is already present in the index.
 */
public class DuplicateColumnException extends MemframeException {

    public DuplicateColumnException(String message) {
        super(message);
    }

    public static DuplicateColumnException of(String name) {
        return new DuplicateColumnException("Duplicate column name: " + name);
    }
}
