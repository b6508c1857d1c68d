package dev.fumaz.conduit.exception;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Indicates that no binding, nested container or constructor could supply an instance of a type.
 */
public class UnresolvedClassException extends UnresolvedDependencyException {

    private final @NotNull Class<?> type;

    public UnresolvedClassException(@NotNull Class<?> type) {
        this(type, null);
    }

    public UnresolvedClassException(@NotNull Class<?> type, @Nullable Throwable cause) {
        this("Unable to resolve dependency for " + type.getName(), type, cause);
    }

    protected UnresolvedClassException(String message, @NotNull Class<?> type, @Nullable Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public @NotNull Class<?> getType() {
        return type;
    }
}
