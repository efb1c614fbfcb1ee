package io.memframe.core;

/**
 * A row-range write addressed a column that does not exist. Row-range writes never create columns.
 */
public class NonExistentTargetException extends MemframeException {

    public NonExistentTargetException(String message) {
        super(message);
    }
}
