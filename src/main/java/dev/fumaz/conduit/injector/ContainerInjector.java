package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.container.Container;
import org.jetbrains.annotations.NotNull;

/**
 * Injects dependencies resolved from a container.
 */
public class ContainerInjector extends ConduitInjector {

    public ContainerInjector(@NotNull Container container) {
        super(new ContainerParameterResolver(container));
    }

}
