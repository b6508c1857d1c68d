package dev.fumaz.conduit.container;

import dev.fumaz.conduit.lifetime.Lifetime;
import dev.fumaz.conduit.lifetime.LifetimeStrategyFactory;
import dev.fumaz.conduit.provider.ClassInstanceProvider;
import dev.fumaz.conduit.provider.FactoryInstanceProvider;
import dev.fumaz.conduit.provider.ImplementationInstanceProvider;
import dev.fumaz.conduit.provider.InstanceProvider;
import dev.fumaz.conduit.provider.ObjectInstanceProvider;
import dev.fumaz.conduit.reflect.Invocable;
import dev.fumaz.conduit.reflect.Invocables;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A {@link BindingBuilder} is used to create a {@link Binding} in a {@link ConduitContainer}. Bindings are
 * transient unless a lifetime is chosen.
 *
 * @param <T> the type of the class
 */
public class BindingBuilder<T> {

    private final @NotNull Class<T> type;
    private final @NotNull ConduitContainer container;

    private @NotNull LifetimeStrategyFactory lifetime = Lifetime.TRANSIENT;

    public BindingBuilder(@NotNull Class<T> type, @NotNull ConduitContainer container) {
        this.type = type;
        this.container = container;
    }

    public BindingBuilder<T> in(@NotNull LifetimeStrategyFactory lifetime) {
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        return this;
    }

    public BindingBuilder<T> asSingleton() {
        return in(Lifetime.SINGLETON);
    }

    public BindingBuilder<T> asTransient() {
        return in(Lifetime.TRANSIENT);
    }

    public Binding<T> toProvider(@NotNull InstanceProvider<? extends T> provider) {
        Objects.requireNonNull(provider, "provider");

        return container.add(type, lifetime.create(type), provider);
    }

    public Binding<T> toSelf() {
        return toProvider(new ClassInstanceProvider<>(type, container.getInjector(), null));
    }

    /**
     * Autowires the type and then calls {@code mutator} with the new instance as argument {@code 0}.
     */
    public Binding<T> toSelf(@NotNull Invocable<?> mutator) {
        Objects.requireNonNull(mutator, "mutator");

        return toProvider(new ClassInstanceProvider<>(type, container.getInjector(), mutator));
    }

    public Binding<T> to(@NotNull Class<? extends T> implementation) {
        return toProvider(new ImplementationInstanceProvider<>(type, implementation, container));
    }

    public Binding<T> toFactory(@NotNull Invocable<?> factory) {
        return toProvider(new FactoryInstanceProvider<>(type, factory, container.getInjector()));
    }

    public <A> Binding<T> toFactory(@NotNull Class<A> dependency,
                                    @NotNull Function<? super A, ? extends T> factory) {
        return toFactory(Invocables.of(dependency, factory));
    }

    public <A, B> Binding<T> toFactory(@NotNull Class<A> first,
                                       @NotNull Class<B> second,
                                       @NotNull BiFunction<? super A, ? super B, ? extends T> factory) {
        return toFactory(Invocables.of(first, second, factory));
    }

    public Binding<T> toSupplier(@NotNull Supplier<? extends T> supplier) {
        return toFactory(Invocables.supplier(supplier));
    }

    public Binding<T> toInstance(@Nullable T instance) {
        return toProvider(new ObjectInstanceProvider<>(type, instance));
    }

}
