package io.memframe.core;

/**
 * Two extents that must agree do not, such as column lengths or a mask against the selected axis.
 */
public class LengthMismatchException extends MemframeException {

    public LengthMismatchException(String message) {
        super(message);
    }

    public static LengthMismatchException of(String what, int expected, int actual) {
        return new LengthMismatchException(what + ": expected length " + expected + " but was " + actual);
    }
}
