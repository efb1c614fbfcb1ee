package io.memframe.core;

/**
 * A column name or position does not resolve to an existing column.
 */
public class UnknownColumnException extends MemframeException {

    public UnknownColumnException(String message) {
        super(message);
    }

    public static UnknownColumnException of(Object key) {
        return new UnknownColumnException("Unknown column: " + key);
    }
}
