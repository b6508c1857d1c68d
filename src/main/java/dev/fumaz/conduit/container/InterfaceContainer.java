package dev.fumaz.conduit.container;

import dev.fumaz.conduit.injector.Injector;
import dev.fumaz.conduit.reflect.Invocable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Provides every strict subtype of a class or interface. The supertype itself is never provided.
 */
public class InterfaceContainer extends AutowiringContainer {

    private final @NotNull Class<?> supertype;

    public InterfaceContainer(@NotNull Class<?> supertype) {
        this(supertype, null, null);
    }

    public InterfaceContainer(@NotNull Class<?> supertype, @Nullable Injector injector, @Nullable Invocable<?> factory) {
        super(injector, factory);
        this.supertype = Objects.requireNonNull(supertype, "supertype");
    }

    @Override
    public boolean has(@NotNull Class<?> type) {
        return type != supertype && supertype.isAssignableFrom(type);
    }

    public @NotNull Class<?> getSupertype() {
        return supertype;
    }

    @Override
    public String toString() {
        return "subtypes of " + supertype.getName();
    }

}
