package dev.fumaz.conduit.exception;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Thrown when a parameter cannot be resolved because its type is part of a dependency cycle.
 */
public class CircularParameterException extends UnresolvedParameterException implements CircularException {

    private final @NotNull List<Class<?>> cyclePath;

    public CircularParameterException(@NotNull String functionName,
                                      @NotNull String parameterName,
                                      @NotNull Class<?> parameterType,
                                      @NotNull CircularException cause) {
        super(functionName, parameterName, parameterType, (Throwable) cause);
        this.cyclePath = cause.getCyclePath();
    }

    @Override
    public @NotNull Class<?> getType() {
        return getParameterType();
    }

    @Override
    public @NotNull List<Class<?>> getCyclePath() {
        return cyclePath;
    }
}
