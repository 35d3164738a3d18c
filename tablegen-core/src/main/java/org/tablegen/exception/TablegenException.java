package org.tablegen.exception;

/**
 * Base of every failure raised while loading a catalog or generating structs.
 * Generation is all-or-nothing, so none of these are recovered locally.
 */
public class TablegenException extends RuntimeException {

    public TablegenException(String message) {
        super(message);
    }

    public TablegenException(String message, Throwable cause) {
        super(message, cause);
    }
}
