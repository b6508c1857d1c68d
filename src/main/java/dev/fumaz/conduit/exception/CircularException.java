package dev.fumaz.conduit.exception;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Implemented by exceptions that report a dependency which could not be resolved because it depends on itself.
 */
public interface CircularException {

    /**
     * @return the type that could not be resolved
     */
    @NotNull Class<?> getType();

    /**
     * @return the types participating in the cycle, starting and ending with the repeated type
     */
    @NotNull List<Class<?>> getCyclePath();
}
