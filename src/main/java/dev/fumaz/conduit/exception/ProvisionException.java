package dev.fumaz.conduit.exception;

/**
 * Signals a failure while providing an instance or invoking an injected function.
 */
public class ProvisionException extends ConduitException {

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
