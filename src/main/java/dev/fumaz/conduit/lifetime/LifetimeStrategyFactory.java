package dev.fumaz.conduit.lifetime;

import org.jetbrains.annotations.NotNull;

/**
 * Creates a fresh {@link LifetimeStrategy} for a type. Used by containers to manage instances obtained from
 * nested containers, which only supply raw values.
 */
public interface LifetimeStrategyFactory {

    <T> @NotNull LifetimeStrategy<T> create(@NotNull Class<T> type);

}
