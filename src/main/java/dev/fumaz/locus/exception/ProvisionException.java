package dev.fumaz.locus.exception;

/**
 * Signals that a factory or an invoked callable failed while providing a value.
 */
public class ProvisionException extends LocusException {

    public ProvisionException(String message) {
        super(message);
    }

    public ProvisionException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProvisionException(Throwable cause) {
        super(cause);
    }
}
