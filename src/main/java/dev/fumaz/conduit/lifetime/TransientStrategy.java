package dev.fumaz.conduit.lifetime;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A {@link LifetimeStrategy} that invokes the factory on every request.
 *
 * @param <T> the type of the managed instances
 */
public class TransientStrategy<T> implements LifetimeStrategy<T> {

    private final @NotNull Class<T> type;

    public TransientStrategy(@NotNull Class<T> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public @NotNull T get(@NotNull Supplier<? extends T> factory) {
        T instance = factory.get();

        if (instance == null) {
            throw new IllegalStateException("Transient instance of " + type.getName() + " cannot be null");
        }

        return instance;
    }

    @Override
    public String toString() {
        return "transient " + type.getName();
    }
}
