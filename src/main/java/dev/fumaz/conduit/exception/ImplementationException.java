package dev.fumaz.conduit.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when an implementation registered for a type is the type itself or is not a subtype of it.
 */
public class ImplementationException extends ConfigurationException {

    private final @NotNull Class<?> type;
    private final @NotNull Class<?> implementation;

    public ImplementationException(@NotNull Class<?> type, @NotNull Class<?> implementation) {
        super(implementation.getName() + " is not a proper implementation of " + type.getName());
        this.type = type;
        this.implementation = implementation;
    }

    public @NotNull Class<?> getType() {
        return type;
    }

    public @NotNull Class<?> getImplementation() {
        return implementation;
    }
}
