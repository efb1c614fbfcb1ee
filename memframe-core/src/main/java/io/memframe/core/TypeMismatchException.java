package io.memframe.core;

/**
 * A value cannot be stored in a column of the given element type.
 */
public class TypeMismatchException extends MemframeException {

    public TypeMismatchException(String message) {
        super(message);
    }

    public static TypeMismatchException of(Object value, ColumnType type) {
        return new TypeMismatchException("Cannot store " + value.getClass().getSimpleName()
                + " value '" + value + "' in a " + type + " column");
    }
}
