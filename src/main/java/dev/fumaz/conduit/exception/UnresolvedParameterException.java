package dev.fumaz.conduit.exception;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Indicates that a parameter of an injected function or constructor could be satisfied neither by an explicit
 * argument nor by the container, and declares no default and does not accept {@code null}.
 */
public class UnresolvedParameterException extends UnresolvedDependencyException {

    private final @NotNull String functionName;
    private final @NotNull String parameterName;
    private final @NotNull Class<?> parameterType;

    public UnresolvedParameterException(@NotNull String functionName,
                                        @NotNull String parameterName,
                                        @NotNull Class<?> parameterType) {
        this(functionName, parameterName, parameterType, null);
    }

    public UnresolvedParameterException(@NotNull String functionName,
                                        @NotNull String parameterName,
                                        @NotNull Class<?> parameterType,
                                        @Nullable Throwable cause) {
        super("Unable to resolve parameter '" + parameterName + "' (" + parameterType.getName() + ") of "
                + functionName, cause);
        this.functionName = functionName;
        this.parameterName = parameterName;
        this.parameterType = parameterType;
    }

    public @NotNull String getFunctionName() {
        return functionName;
    }

    public @NotNull String getParameterName() {
        return parameterName;
    }

    public @NotNull Class<?> getParameterType() {
        return parameterType;
    }
}
