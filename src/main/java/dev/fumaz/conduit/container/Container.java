package dev.fumaz.conduit.container;

import org.jetbrains.annotations.NotNull;

/**
 * A {@link Container} provides instances of types.
 */
public interface Container {

    /**
     * Checks whether this container can provide the given type. Nothing is constructed.
     */
    boolean has(@NotNull Class<?> type);

    /**
     * Provides an instance of the given type.
     *
     * @throws dev.fumaz.conduit.exception.UnresolvedClassException if the type cannot be provided
     */
    <T> @NotNull T get(@NotNull Class<T> type);

}
