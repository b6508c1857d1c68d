package dev.fumaz.conduit.module;

import dev.fumaz.conduit.container.ConduitContainer;
import org.jetbrains.annotations.NotNull;

/**
 * A {@link Module} is a reusable piece of container configuration.
 */
@FunctionalInterface
public interface Module {

    void configure(@NotNull ConduitContainer container);

}
