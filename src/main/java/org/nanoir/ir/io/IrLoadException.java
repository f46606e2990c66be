package org.nanoir.ir.io;

/**
 * Thrown when an IR document cannot be read or does not map onto the IR model.
 */
public class IrLoadException extends Exception {

    public IrLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
