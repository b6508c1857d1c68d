package dev.fumaz.conduit.provider;

import dev.fumaz.conduit.exception.InstanceTypeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An {@link ObjectInstanceProvider} is an {@link InstanceProvider} that always provides the same, pre-built
 * instance. The instance is checked against the type when the provider is created.
 *
 * @param <T> the type of the class
 */
public class ObjectInstanceProvider<T> implements InstanceProvider<T> {

    private final @NotNull T instance;

    public ObjectInstanceProvider(@NotNull Class<T> type, @Nullable Object instance) {
        if (!type.isInstance(instance)) {
            throw new InstanceTypeException(type, instance);
        }

        this.instance = type.cast(instance);
    }

    @Override
    public @NotNull T get() {
        return instance;
    }

}
