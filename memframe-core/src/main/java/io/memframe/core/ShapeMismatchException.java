package io.memframe.core;

/**
 * A table value does not have the column count its target selection requires.
 */
public class ShapeMismatchException extends MemframeException {

    public ShapeMismatchException(String message) {
        super(message);
    }
}
