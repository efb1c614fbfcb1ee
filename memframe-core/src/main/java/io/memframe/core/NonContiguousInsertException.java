package io.memframe.core;

/**
 * A column was addressed by a position past the next free slot.
 */
public class NonContiguousInsertException extends MemframeException {

    public NonContiguousInsertException(String message) {
        super(message);
    }
}
