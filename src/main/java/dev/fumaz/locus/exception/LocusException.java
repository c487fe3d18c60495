package dev.fumaz.locus.exception;

/**
 * Base unchecked exception for container failures.
 */
public class LocusException extends RuntimeException {

    public LocusException(String message) {
        super(message);
    }

    public LocusException(String message, Throwable cause) {
        super(message, cause);
    }

    public LocusException(Throwable cause) {
        super(cause);
    }
}
