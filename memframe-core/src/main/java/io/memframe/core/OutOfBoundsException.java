package io.memframe.core;

/**
 * A row position lies outside the rows of the table it addresses.
 */
public class OutOfBoundsException extends MemframeException {

    public OutOfBoundsException(String message) {
        super(message);
    }

    public static OutOfBoundsException of(int position, int bound) {
        return new OutOfBoundsException("Row position " + position + " out of range [0, " + bound + ")");
    }
}
