package org.tablegen.exception;

/**
 * The column metadata statement of a backend could not be compiled. Points at a defect
 * in the backend's SQL rather than at the target database.
 */
public class PrepareException extends TablegenException {

    public PrepareException(String message, Throwable cause) {
        super(message, cause);
    }
}
