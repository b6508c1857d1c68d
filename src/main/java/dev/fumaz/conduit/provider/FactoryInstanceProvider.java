package dev.fumaz.conduit.provider;

import dev.fumaz.conduit.exception.InstanceTypeException;
import dev.fumaz.conduit.injector.Injector;
import dev.fumaz.conduit.reflect.Invocable;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A {@link FactoryInstanceProvider} is an {@link InstanceProvider} that calls a factory whose parameters are
 * injected. The result must be a non-null instance of the provided type.
 *
 * @param <T> the type of the class
 */
public class FactoryInstanceProvider<T> implements InstanceProvider<T> {

    private final @NotNull Class<T> type;
    private final @NotNull Invocable<?> factory;
    private final @NotNull Injector injector;

    public FactoryInstanceProvider(@NotNull Class<T> type, @NotNull Invocable<?> factory, @NotNull Injector injector) {
        this.type = Objects.requireNonNull(type, "type");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.injector = Objects.requireNonNull(injector, "injector");
    }

    @Override
    public @NotNull T get() {
        Object instance = injector.call(factory);

        if (!type.isInstance(instance)) {
            throw new InstanceTypeException(type, instance);
        }

        return type.cast(instance);
    }

}
