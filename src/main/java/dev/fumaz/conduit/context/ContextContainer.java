package dev.fumaz.conduit.context;

import dev.fumaz.conduit.container.Container;
import dev.fumaz.conduit.injector.Injector;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link Container} that resolves types through a stack of named contexts.
 * <p>
 * Each thread has its own stack. {@link #get(Class)} asks the contexts from the most recently pushed one down and
 * falls back to the default container. Names that have no container are skipped.
 * <p>
 * Containers created by the factory receive a {@link ContextInjector} bound to this container, so their own
 * dependencies are resolved through the context stack as well.
 *
 * @param <C> the type of the containers
 */
public class ContextContainer<C extends Container> implements Container {

    private static final Logger LOGGER = Logger.getLogger(ContextContainer.class.getName());

    private final @NotNull Function<? super Injector, ? extends C> factory;
    private final @NotNull ContextInjector injector;
    private final @NotNull C defaultContainer;
    private final Map<String, C> contexts = new ConcurrentHashMap<>();
    private final ThreadLocal<Deque<String>> stack = new ThreadLocal<>();

    public ContextContainer(@NotNull Function<? super Injector, ? extends C> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.injector = new ContextInjector(this);
        this.defaultContainer = Objects.requireNonNull(factory.apply(injector), "default container");
    }

    /**
     * Returns the container of a context, creating it on first use.
     */
    public @NotNull C context(@NotNull String name) {
        Objects.requireNonNull(name, "name");

        return contexts.computeIfAbsent(name, ignored -> {
            LOGGER.log(Level.FINE, "Creating context {0}", name);
            return Objects.requireNonNull(factory.apply(injector), "context container");
        });
    }

    public void addContext(@NotNull String name, @NotNull C container) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(container, "container");

        if (contexts.put(name, container) != null) {
            LOGGER.log(Level.FINE, "Replaced context {0}", name);
        }
    }

    public @Nullable C getContext(@NotNull String name) {
        return contexts.get(name);
    }

    public @NotNull C getDefault() {
        return defaultContainer;
    }

    public void push(@NotNull String name) {
        Objects.requireNonNull(name, "name");

        Deque<String> current = stack.get();

        if (current == null) {
            current = new ArrayDeque<>();
            stack.set(current);
        }

        current.push(name);
        LOGGER.log(Level.FINER, "Entered context {0}", name);
    }

    /**
     * @return the name that was removed
     * @throws IllegalStateException if no context is active on this thread
     */
    public @NotNull String pop() {
        Deque<String> current = stack.get();

        if (current == null || current.isEmpty()) {
            throw new IllegalStateException("No active context to pop");
        }

        String name = current.pop();

        if (current.isEmpty()) {
            stack.remove();
        }

        LOGGER.log(Level.FINER, "Left context {0}", name);
        return name;
    }

    /**
     * Pushes the given contexts in order. Closing the returned scope pops them again.
     */
    public @NotNull ContextScope enter(@NotNull String... names) {
        int pushed = 0;

        try {
            for (String name : names) {
                push(name);
                pushed++;
            }
        } catch (RuntimeException e) {
            for (int i = 0; i < pushed; i++) {
                pop();
            }

            throw e;
        }

        return new ContextScope(this, pushed);
    }

    /**
     * The active contexts of this thread, most recent first.
     */
    public @NotNull List<String> getActiveContexts() {
        Deque<String> current = stack.get();

        if (current == null) {
            return Collections.emptyList();
        }

        return Collections.unmodifiableList(new ArrayList<>(current));
    }

    @Override
    public boolean has(@NotNull Class<?> type) {
        Deque<String> current = stack.get();

        if (current != null) {
            for (String name : current) {
                C container = contexts.get(name);

                if (container != null && container.has(type)) {
                    return true;
                }
            }
        }

        return defaultContainer.has(type);
    }

    @Override
    public <T> @NotNull T get(@NotNull Class<T> type) {
        Deque<String> current = stack.get();

        if (current != null) {
            for (String name : new ArrayList<>(current)) {
                C container = contexts.get(name);

                if (container != null && container.has(type)) {
                    return container.get(type);
                }
            }
        }

        return defaultContainer.get(type);
    }

    public @NotNull Injector getInjector() {
        return injector;
    }

}
