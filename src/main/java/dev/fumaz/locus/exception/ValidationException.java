package dev.fumaz.locus.exception;

/**
 * Indicates an invalid callable, type or value detected before anything is invoked or registered.
 */
public class ValidationException extends LocusException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
