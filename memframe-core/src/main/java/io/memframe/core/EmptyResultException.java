package io.memframe.core;

/**
 * An operation would leave a table with no columns.
 */
public class EmptyResultException extends MemframeException {

    public EmptyResultException(String message) {
        super(message);
    }
}
