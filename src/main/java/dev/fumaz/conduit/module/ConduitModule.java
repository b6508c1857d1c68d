package dev.fumaz.conduit.module;

import dev.fumaz.conduit.container.BindingBuilder;
import dev.fumaz.conduit.container.ConduitContainer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Base class for modules that declare their bindings in {@link #configure()}.
 */
public abstract class ConduitModule implements Module {

    private @Nullable ConduitContainer container;

    @Override
    public final void configure(@NotNull ConduitContainer container) {
        Objects.requireNonNull(container, "container");

        if (this.container != null) {
            throw new IllegalStateException(getClass().getName() + " is already being configured");
        }

        this.container = container;

        try {
            configure();
        } finally {
            this.container = null;
        }
    }

    protected abstract void configure();

    /**
     * The container being configured. Only available inside {@link #configure()}.
     */
    protected final @NotNull ConduitContainer container() {
        if (container == null) {
            throw new IllegalStateException("The container is only available while " + getClass().getName()
                    + " is being configured");
        }

        return container;
    }

    protected final <T> @NotNull BindingBuilder<T> bind(@NotNull Class<T> type) {
        return container().bind(type);
    }

    protected final void install(@NotNull Module module) {
        Objects.requireNonNull(module, "module");

        if (module == this) {
            throw new IllegalArgumentException("A module cannot install itself");
        }

        container().install(module);
    }

}
