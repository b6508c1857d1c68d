package dev.fumaz.conduit.container;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Configuration object controlling how a {@link ConduitContainer} accepts bindings.
 */
public final class ContainerOptions {

    private final @NotNull String name;
    private final @NotNull BindingPolicy bindingPolicy;

    private ContainerOptions(@NotNull String name, @NotNull BindingPolicy bindingPolicy) {
        this.name = name;
        this.bindingPolicy = bindingPolicy;
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull BindingPolicy getBindingPolicy() {
        return bindingPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ContainerOptions defaults() {
        return builder().build();
    }

    /**
     * What happens when a type that already has a binding is bound again.
     */
    public enum BindingPolicy {
        /**
         * The new binding replaces the old one.
         */
        OVERWRITE,
        /**
         * The new binding is refused with a {@link dev.fumaz.conduit.exception.ConfigurationException}.
         */
        REJECT
    }

    public static final class Builder {
        private String name = "conduit";
        private BindingPolicy bindingPolicy = BindingPolicy.OVERWRITE;

        public Builder name(@NotNull String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder bindingPolicy(@NotNull BindingPolicy bindingPolicy) {
            this.bindingPolicy = Objects.requireNonNull(bindingPolicy, "bindingPolicy");
            return this;
        }

        public Builder rejectDuplicates() {
            return bindingPolicy(BindingPolicy.REJECT);
        }

        public ContainerOptions build() {
            return new ContainerOptions(name, bindingPolicy);
        }
    }
}
