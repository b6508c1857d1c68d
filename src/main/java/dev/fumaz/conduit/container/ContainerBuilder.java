package dev.fumaz.conduit.container;

import dev.fumaz.conduit.lifetime.LifetimeStrategy;
import dev.fumaz.conduit.lifetime.LifetimeStrategyFactory;
import dev.fumaz.conduit.provider.InstanceProvider;
import org.jetbrains.annotations.NotNull;

/**
 * A {@link Container} whose bindings and nested containers can be changed.
 */
public interface ContainerBuilder extends Container {

    <T> @NotNull Binding<T> add(@NotNull Class<T> type,
                                @NotNull LifetimeStrategy<T> strategy,
                                @NotNull InstanceProvider<? extends T> provider);

    /**
     * Appends a nested container. Nested containers are consulted in the order they were added, after the local
     * bindings. Every type resolved through the nested container gets its own strategy from the factory.
     */
    void addContainer(@NotNull Container container, @NotNull LifetimeStrategyFactory lifetime);

    /**
     * @return whether a binding was removed
     */
    boolean remove(@NotNull Class<?> type);

}
