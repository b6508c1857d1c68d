package dev.fumaz.conduit.lifetime;

import org.jetbrains.annotations.NotNull;

/**
 * The built-in lifetimes.
 */
public enum Lifetime implements LifetimeStrategyFactory {

    /**
     * One instance per binding, created on first use.
     */
    SINGLETON {
        @Override
        public <T> @NotNull LifetimeStrategy<T> create(@NotNull Class<T> type) {
            return new SingletonStrategy<>(type);
        }
    },

    /**
     * A new instance for every request.
     */
    TRANSIENT {
        @Override
        public <T> @NotNull LifetimeStrategy<T> create(@NotNull Class<T> type) {
            return new TransientStrategy<>(type);
        }
    }

}
