package dev.fumaz.conduit.context;

import dev.fumaz.conduit.injector.ConduitInjector;
import dev.fumaz.conduit.injector.ContainerParameterResolver;
import dev.fumaz.conduit.reflect.ParameterSpec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * An injector that resolves parameters from a {@link ContextContainer}, entering the contexts a parameter declares
 * with {@link dev.fumaz.conduit.annotation.Context} while it is resolved.
 */
public class ContextInjector extends ConduitInjector {

    private final @NotNull ContextContainer<?> container;

    public ContextInjector(@NotNull ContextContainer<?> container) {
        super(new ContainerParameterResolver(container));
        this.container = container;
    }

    @Override
    protected @Nullable Object resolveParameter(@NotNull ParameterSpec parameter) {
        List<String> contexts = parameter.getContexts();

        if (contexts.isEmpty()) {
            return super.resolveParameter(parameter);
        }

        int pushed = 0;

        try {
            for (String context : contexts) {
                container.push(context);
                pushed++;
            }

            return super.resolveParameter(parameter);
        } finally {
            for (int i = 0; i < pushed; i++) {
                container.pop();
            }
        }
    }

    public @NotNull ContextContainer<?> getContainer() {
        return container;
    }

}
