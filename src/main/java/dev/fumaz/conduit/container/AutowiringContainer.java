package dev.fumaz.conduit.container;

import dev.fumaz.conduit.exception.CircularDependencyException;
import dev.fumaz.conduit.exception.CircularException;
import dev.fumaz.conduit.exception.ConduitException;
import dev.fumaz.conduit.exception.InstanceTypeException;
import dev.fumaz.conduit.exception.UnresolvedClassException;
import dev.fumaz.conduit.injector.ContainerInjector;
import dev.fumaz.conduit.injector.Injector;
import dev.fumaz.conduit.reflect.Invocable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link Container} that provides every type matching a rule, either by autowiring its constructor or by calling
 * a factory that receives the requested class as argument {@code 0}.
 * <p>
 * Without an injector of its own, the container injects from itself.
 */
public abstract class AutowiringContainer implements Container {

    private final @NotNull Injector injector;
    private final @Nullable Invocable<?> factory;
    private final ResolutionFrames frames = new ResolutionFrames();

    protected AutowiringContainer(@Nullable Injector injector, @Nullable Invocable<?> factory) {
        this.injector = injector != null ? injector : new ContainerInjector(this);
        this.factory = factory;
    }

    @Override
    public <T> @NotNull T get(@NotNull Class<T> type) {
        Objects.requireNonNull(type, "type");

        if (!has(type)) {
            throw new UnresolvedClassException(type);
        }

        frames.begin(type);

        try {
            return create(type);
        } catch (ConduitException e) {
            if (e instanceof CircularException) {
                throw new CircularDependencyException(type, (CircularException) e);
            }

            throw e;
        } finally {
            frames.end(type);
        }
    }

    /**
     * The explicit arguments passed to the factory for the given type.
     */
    protected @NotNull Map<Object, Object> factoryArguments(@NotNull Class<?> type) {
        Map<Object, Object> arguments = new HashMap<>();
        arguments.put(0, type);

        return arguments;
    }

    public @NotNull Injector getInjector() {
        return injector;
    }

    private <T> T create(Class<T> type) {
        if (factory == null) {
            return injector.instantiate(type);
        }

        Object instance = injector.call(factory, factoryArguments(type));

        if (!type.isInstance(instance)) {
            throw new InstanceTypeException(type, instance);
        }

        return type.cast(instance);
    }

}
