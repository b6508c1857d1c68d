package dev.fumaz.conduit.exception;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a type is requested from a container while the same container is already resolving it on the
 * current thread.
 */
public class CircularDependencyException extends UnresolvedClassException implements CircularException {

    private final @NotNull List<Class<?>> cyclePath;

    /**
     * Reports a freshly detected cycle.
     *
     * @param type      the type requested a second time
     * @param cyclePath the resolution path from the first request of {@code type} up to the repeated request
     */
    public CircularDependencyException(@NotNull Class<?> type, @NotNull List<Class<?>> cyclePath) {
        super(describe(type, cyclePath), type, null);
        this.cyclePath = List.copyOf(cyclePath);
    }

    /**
     * Reports that resolving {@code type} failed because one of its dependencies is circular.
     */
    public CircularDependencyException(@NotNull Class<?> type, @NotNull CircularException cause) {
        super("Circular dependency while resolving " + type.getName(), type, (Throwable) cause);
        this.cyclePath = cause.getCyclePath();
    }

    @Override
    public @NotNull List<Class<?>> getCyclePath() {
        return Collections.unmodifiableList(cyclePath);
    }

    private static String describe(Class<?> type, List<Class<?>> cyclePath) {
        String lineSeparator = System.lineSeparator();
        StringBuilder builder = new StringBuilder();

        builder.append("Dependency cycle detected while resolving ")
                .append(type.getName())
                .append(lineSeparator)
                .append("Cycle path:");

        for (Class<?> step : cyclePath) {
            builder.append(lineSeparator).append(" - ").append(step.getName());
        }

        return builder.toString();
    }
}
