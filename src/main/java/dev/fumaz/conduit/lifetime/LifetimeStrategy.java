package dev.fumaz.conduit.lifetime;

import org.jetbrains.annotations.NotNull;

import java.util.function.Supplier;

/**
 * Decides whether the value produced by a factory is reused or recomputed.
 * A strategy knows nothing about what is being constructed.
 *
 * @param <T> the type of the managed instances
 */
@FunctionalInterface
public interface LifetimeStrategy<T> {

    /**
     * Returns an instance, invoking {@code factory} when the strategy has no reusable value.
     */
    @NotNull T get(@NotNull Supplier<? extends T> factory);

}
