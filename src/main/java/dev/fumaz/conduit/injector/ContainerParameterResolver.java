package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.container.Container;
import dev.fumaz.conduit.reflect.ParameterSpec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Resolves parameters by their declared type from a {@link Container}.
 */
public class ContainerParameterResolver implements ParameterResolver {

    private final @NotNull Container container;

    public ContainerParameterResolver(@NotNull Container container) {
        this.container = Objects.requireNonNull(container, "container");
    }

    @Override
    public @Nullable Object resolve(@NotNull ParameterSpec parameter) {
        Class<?> type = parameter.getType();

        if (type.isPrimitive() || !container.has(type)) {
            return null;
        }

        return container.get(type);
    }

    public @NotNull Container getContainer() {
        return container;
    }
}
