package dev.fumaz.conduit.provider;

import dev.fumaz.conduit.container.Container;
import dev.fumaz.conduit.exception.ImplementationException;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An {@link ImplementationInstanceProvider} is an {@link InstanceProvider} that resolves a more concrete type from
 * a container. The implementation must be a proper subtype of the provided type.
 *
 * @param <T> the type of the class
 */
public class ImplementationInstanceProvider<T> implements InstanceProvider<T> {

    private final @NotNull Class<T> type;
    private final @NotNull Class<? extends T> implementation;
    private final @NotNull Container container;

    public ImplementationInstanceProvider(@NotNull Class<T> type,
                                          @NotNull Class<? extends T> implementation,
                                          @NotNull Container container) {
        this.type = Objects.requireNonNull(type, "type");
        this.implementation = Objects.requireNonNull(implementation, "implementation");
        this.container = Objects.requireNonNull(container, "container");

        if (type.equals(implementation) || !type.isAssignableFrom(implementation)) {
            throw new ImplementationException(type, implementation);
        }
    }

    @Override
    public @NotNull T get() {
        return type.cast(container.get(implementation));
    }

    public @NotNull Class<? extends T> getImplementation() {
        return implementation;
    }

}
