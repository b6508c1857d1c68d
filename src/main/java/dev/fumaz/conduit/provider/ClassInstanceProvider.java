package dev.fumaz.conduit.provider;

import dev.fumaz.conduit.injector.Injector;
import dev.fumaz.conduit.reflect.Invocable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Objects;

/**
 * A {@link ClassInstanceProvider} is an {@link InstanceProvider} that autowires the constructor of its type.
 * <p>
 * An optional mutator runs after construction. It receives the new instance as its first argument; its other
 * parameters are injected.
 *
 * @param <T> the type of the class
 */
public class ClassInstanceProvider<T> implements InstanceProvider<T> {

    private final @NotNull Class<T> type;
    private final @NotNull Injector injector;
    private final @Nullable Invocable<?> mutator;

    public ClassInstanceProvider(@NotNull Class<T> type, @NotNull Injector injector, @Nullable Invocable<?> mutator) {
        this.type = Objects.requireNonNull(type, "type");
        this.injector = Objects.requireNonNull(injector, "injector");
        this.mutator = mutator;
    }

    @Override
    public @NotNull T get() {
        T instance = injector.instantiate(type);

        if (mutator != null) {
            injector.call(mutator, Collections.singletonMap(0, instance));
        }

        return instance;
    }

}
