package org.nanoir.runtime;

/**
 * A fatal error raised while interpreting a document. Execution is never resumed after one.
 */
public class InterpreterException extends RuntimeException {

    public static final String PREFIX = "Runtime Error: ";

    public InterpreterException(String message) {
        super(prefixed(message));
    }

    public InterpreterException(String message, Throwable cause) {
        super(prefixed(message), cause);
    }

    private static String prefixed(String message) {
        return message.startsWith(PREFIX) ? message : PREFIX + message;
    }
}
