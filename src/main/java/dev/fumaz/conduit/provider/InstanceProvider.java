package dev.fumaz.conduit.provider;

import dev.fumaz.conduit.container.Container;
import dev.fumaz.conduit.injector.Injector;
import dev.fumaz.conduit.reflect.Invocable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An {@link InstanceProvider} produces instances of a type. It never returns {@code null}.
 *
 * @param <T> the type of the class
 */
@FunctionalInterface
public interface InstanceProvider<T> {

    static <T> @NotNull InstanceProvider<T> instance(@NotNull Class<T> type, @Nullable Object instance) {
        return new ObjectInstanceProvider<>(type, instance);
    }

    static <T> @NotNull InstanceProvider<T> factory(@NotNull Class<T> type,
                                                    @NotNull Invocable<?> factory,
                                                    @NotNull Injector injector) {
        return new FactoryInstanceProvider<>(type, factory, injector);
    }

    static <T> @NotNull InstanceProvider<T> autowire(@NotNull Class<T> type, @NotNull Injector injector) {
        return new ClassInstanceProvider<>(type, injector, null);
    }

    static <T> @NotNull InstanceProvider<T> implementation(@NotNull Class<T> type,
                                                           @NotNull Class<? extends T> implementation,
                                                           @NotNull Container container) {
        return new ImplementationInstanceProvider<>(type, implementation, container);
    }

    @NotNull T get();

}
