package io.memframe.core;

/**
 * Root of every failure reported by memframe.
 * <p>
 * All failures are unchecked and raised synchronously to the caller. Subclasses
 * identify the failure kind so callers can react to one of them without string
 * matching on messages.
 */
public class MemframeException extends RuntimeException {

    public MemframeException(Throwable cause) {
        super(cause);
    }

    public MemframeException(String message, Throwable cause) {
        super(message, cause);
    }

    public MemframeException(String message) {
        super(message);
    }

}
