package io.github.flameyossnowy.mongofilter.api.exceptions;

/**
 * A value did not have the shape the caller required, for example a BSON type with no structured
 * counterpart or a non-object where a document is expected.
 */
public class ShapeMismatchException extends RuntimeException {
    public ShapeMismatchException(String message) {
        super(message);
    }

    public ShapeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
