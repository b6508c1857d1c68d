package dev.fumaz.conduit.container;

import dev.fumaz.conduit.lifetime.LifetimeStrategy;
import dev.fumaz.conduit.provider.InstanceProvider;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A {@link Binding} is a link between a type, an {@link InstanceProvider} and the {@link LifetimeStrategy} that
 * decides when the provider is called.
 *
 * @param <T> the type of the class
 */
public class Binding<T> {

    private final @NotNull Class<T> type;
    private final @NotNull LifetimeStrategy<T> strategy;
    private final @NotNull InstanceProvider<? extends T> provider;

    public Binding(@NotNull Class<T> type,
                   @NotNull LifetimeStrategy<T> strategy,
                   @NotNull InstanceProvider<? extends T> provider) {
        this.type = Objects.requireNonNull(type, "type");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public @NotNull T resolve() {
        return strategy.get(provider::get);
    }

    public @NotNull Class<T> getType() {
        return type;
    }

    public @NotNull LifetimeStrategy<T> getStrategy() {
        return strategy;
    }

    public @NotNull InstanceProvider<? extends T> getProvider() {
        return provider;
    }

    @Override
    public String toString() {
        return "Binding{" +
                "type=" + type.getName() +
                ", strategy=" + strategy +
                '}';
    }

}
