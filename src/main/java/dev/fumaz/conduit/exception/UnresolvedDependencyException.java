package dev.fumaz.conduit.exception;

import org.jetbrains.annotations.Nullable;

/**
 * Indicates that a dependency could not be resolved.
 */
public class UnresolvedDependencyException extends ProvisionException {

    public UnresolvedDependencyException(String message) {
        super(message);
    }

    public UnresolvedDependencyException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
