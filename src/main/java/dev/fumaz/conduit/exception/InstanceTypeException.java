package dev.fumaz.conduit.exception;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a provider produces {@code null} or a value that is not an instance of the requested type.
 */
public class InstanceTypeException extends ProvisionException {

    private final @NotNull Class<?> type;
    private final @Nullable Class<?> actualType;

    public InstanceTypeException(@NotNull Class<?> type, @Nullable Object actual) {
        super("Expected an instance of " + type.getName() + " but got "
                + (actual == null ? "null" : "an instance of " + actual.getClass().getName()));
        this.type = type;
        this.actualType = actual == null ? null : actual.getClass();
    }

    public @NotNull Class<?> getType() {
        return type;
    }

    /**
     * @return the class of the rejected value, or {@code null} if the value was {@code null}
     */
    public @Nullable Class<?> getActualType() {
        return actualType;
    }
}
