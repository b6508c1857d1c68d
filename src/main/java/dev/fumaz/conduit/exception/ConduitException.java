package dev.fumaz.conduit.exception;

import org.jetbrains.annotations.Nullable;

/**
 * Base unchecked exception for Conduit-specific failures.
 * <p>
 * When a {@link ConduitException} is created with another {@link ConduitException} as its cause, the two are
 * consolidated: the message of the cause is appended to this exception's message and the cause is exposed through
 * {@link #getConsolidatedException()} instead of {@link #getCause()}. Any other cause is kept in the regular cause
 * chain.
 */
public class ConduitException extends RuntimeException {

    private final @Nullable ConduitException consolidated;

    public ConduitException(String message) {
        super(message);
        this.consolidated = null;
    }

    public ConduitException(String message, @Nullable Throwable cause) {
        super(consolidate(message, cause), cause instanceof ConduitException ? null : cause);
        this.consolidated = cause instanceof ConduitException ? (ConduitException) cause : null;
    }

    public ConduitException(Throwable cause) {
        super(cause);
        this.consolidated = null;
    }

    /**
     * @return the library exception whose message was merged into this one, or {@code null}
     */
    public @Nullable ConduitException getConsolidatedException() {
        return consolidated;
    }

    private static String consolidate(String message, @Nullable Throwable cause) {
        if (!(cause instanceof ConduitException)) {
            return message;
        }

        return message + System.lineSeparator() + cause.getMessage();
    }
}
