package io.memframe.core;

/**
 * The column index and the column list of a table disagree in size.
 */
public class IndexMismatchException extends MemframeException {

    public IndexMismatchException(String message) {
        super(message);
    }
}
