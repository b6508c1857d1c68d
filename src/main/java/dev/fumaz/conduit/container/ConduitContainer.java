package dev.fumaz.conduit.container;

import dev.fumaz.conduit.exception.CircularDependencyException;
import dev.fumaz.conduit.exception.CircularException;
import dev.fumaz.conduit.exception.ConduitException;
import dev.fumaz.conduit.exception.ConfigurationException;
import dev.fumaz.conduit.exception.UnresolvedClassException;
import dev.fumaz.conduit.injector.ContainerInjector;
import dev.fumaz.conduit.injector.Injector;
import dev.fumaz.conduit.lifetime.LifetimeStrategy;
import dev.fumaz.conduit.lifetime.LifetimeStrategyFactory;
import dev.fumaz.conduit.module.Module;
import dev.fumaz.conduit.provider.InstanceProvider;
import dev.fumaz.conduit.reflect.Invocable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The default {@link ContainerBuilder}.
 * <p>
 * {@link #get(Class)} looks at the local bindings first, then at the nested containers in the order they were
 * added. Requesting a type while it is already being resolved on the same thread fails with a
 * {@link CircularDependencyException}.
 */
public class ConduitContainer implements ContainerBuilder {

    private static final Logger LOGGER = Logger.getLogger(ConduitContainer.class.getName());

    private final @NotNull ContainerOptions options;
    private final @NotNull Injector injector;
    private final Map<Class<?>, Binding<?>> bindings = new ConcurrentHashMap<>();
    private final List<NestedContainer> containers = new CopyOnWriteArrayList<>();
    private final ResolutionFrames frames = new ResolutionFrames();

    public ConduitContainer() {
        this(null, ContainerOptions.defaults());
    }

    public ConduitContainer(@NotNull ContainerOptions options) {
        this(null, options);
    }

    /**
     * @param injector the injector used by this container's providers, or {@code null} to inject from this container
     */
    public ConduitContainer(@Nullable Injector injector) {
        this(injector, ContainerOptions.defaults());
    }

    public ConduitContainer(@Nullable Injector injector, @NotNull ContainerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.injector = injector != null ? injector : new ContainerInjector(this);
    }

    public static @NotNull ConduitContainer create(@NotNull Module... modules) {
        ConduitContainer container = new ConduitContainer();
        container.install(modules);

        return container;
    }

    @Override
    public <T> @NotNull Binding<T> add(@NotNull Class<T> type,
                                       @NotNull LifetimeStrategy<T> strategy,
                                       @NotNull InstanceProvider<? extends T> provider) {
        Binding<T> binding = new Binding<>(type, strategy, provider);

        if (options.getBindingPolicy() == ContainerOptions.BindingPolicy.REJECT) {
            if (bindings.putIfAbsent(type, binding) != null) {
                throw new ConfigurationException("A binding for " + type.getName() + " already exists in " + this);
            }
        } else if (bindings.put(type, binding) != null) {
            LOGGER.log(Level.FINE, "Replaced binding for {0}", type.getName());
        }

        LOGGER.log(Level.FINER, "Bound {0}", binding);
        return binding;
    }

    @Override
    public void addContainer(@NotNull Container container, @NotNull LifetimeStrategyFactory lifetime) {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(lifetime, "lifetime");

        if (container == this) {
            throw new ConfigurationException("A container cannot be nested in itself");
        }

        containers.add(new NestedContainer(container, lifetime));
    }

    @Override
    public boolean remove(@NotNull Class<?> type) {
        return bindings.remove(type) != null;
    }

    @Override
    public boolean has(@NotNull Class<?> type) {
        if (bindings.containsKey(type)) {
            return true;
        }

        for (NestedContainer nested : containers) {
            if (nested.container.has(type)) {
                return true;
            }
        }

        return false;
    }

    @Override
    public <T> @NotNull T get(@NotNull Class<T> type) {
        Objects.requireNonNull(type, "type");

        frames.begin(type);

        try {
            return resolve(type);
        } catch (ConduitException e) {
            if (e instanceof CircularException) {
                throw new CircularDependencyException(type, (CircularException) e);
            }

            throw e;
        } finally {
            frames.end(type);
        }
    }

    public <T> @NotNull BindingBuilder<T> bind(@NotNull Class<T> type) {
        return new BindingBuilder<>(Objects.requireNonNull(type, "type"), this);
    }

    public @Nullable Binding<?> getBinding(@NotNull Class<?> type) {
        return bindings.get(type);
    }

    public @NotNull ConduitContainer addNamespace(@NotNull String prefix, @NotNull LifetimeStrategyFactory lifetime) {
        return addNamespace(prefix, lifetime, null);
    }

    /**
     * Resolves every type whose name is in the given package (or one of its subpackages) by autowiring or by
     * calling {@code factory} with the requested class as argument {@code 0}.
     */
    public @NotNull ConduitContainer addNamespace(@NotNull String prefix,
                                                  @NotNull LifetimeStrategyFactory lifetime,
                                                  @Nullable Invocable<?> factory) {
        addContainer(new NamespaceContainer(prefix, injector, factory), lifetime);
        return this;
    }

    public @NotNull ConduitContainer addInterface(@NotNull Class<?> supertype,
                                                  @NotNull LifetimeStrategyFactory lifetime) {
        return addInterface(supertype, lifetime, null);
    }

    public @NotNull ConduitContainer addInterface(@NotNull Class<?> supertype,
                                                  @NotNull LifetimeStrategyFactory lifetime,
                                                  @Nullable Invocable<?> factory) {
        addContainer(new InterfaceContainer(supertype, injector, factory), lifetime);
        return this;
    }

    public @NotNull ConduitContainer addAnnotation(@NotNull Class<? extends Annotation> annotationType,
                                                   @NotNull LifetimeStrategyFactory lifetime) {
        return addAnnotation(annotationType, lifetime, null);
    }

    /**
     * Resolves every type annotated with {@code annotationType}. The optional factory receives the requested class
     * as argument {@code 0} and the annotation as argument {@code 1}.
     */
    public @NotNull ConduitContainer addAnnotation(@NotNull Class<? extends Annotation> annotationType,
                                                   @NotNull LifetimeStrategyFactory lifetime,
                                                   @Nullable Invocable<?> factory) {
        addContainer(new AnnotationContainer(annotationType, injector, factory), lifetime);
        return this;
    }

    public @NotNull ConduitContainer install(@NotNull Module... modules) {
        for (Module module : modules) {
            Objects.requireNonNull(module, "module");

            LOGGER.log(Level.FINE, "Installing {0} into {1}", new Object[]{module.getClass().getName(), this});
            module.configure(this);
        }

        return this;
    }

    public @NotNull Injector getInjector() {
        return injector;
    }

    public @NotNull ContainerOptions getOptions() {
        return options;
    }

    @SuppressWarnings("unchecked")
    private <T> T resolve(Class<T> type) {
        Binding<T> binding = (Binding<T>) bindings.get(type);

        if (binding != null) {
            LOGGER.log(Level.FINER, "Resolving {0} from its binding", type.getName());
            return binding.resolve();
        }

        for (NestedContainer nested : containers) {
            if (nested.container.has(type)) {
                LOGGER.log(Level.FINER, "Resolving {0} from {1}", new Object[]{type.getName(), nested.container});
                return nested.get(type);
            }
        }

        throw new UnresolvedClassException(type);
    }

    @Override
    public String toString() {
        return options.getName();
    }

    private static final class NestedContainer {

        private final Container container;
        private final LifetimeStrategyFactory lifetime;
        private final ConcurrentMap<Class<?>, LifetimeStrategy<?>> strategies = new ConcurrentHashMap<>();

        private NestedContainer(Container container, LifetimeStrategyFactory lifetime) {
            this.container = container;
            this.lifetime = lifetime;
        }

        @SuppressWarnings("unchecked")
        private <T> T get(Class<T> type) {
            LifetimeStrategy<T> strategy = (LifetimeStrategy<T>) strategies.computeIfAbsent(type,
                    key -> lifetime.create(key));

            return strategy.get(() -> container.get(type));
        }
    }
}
