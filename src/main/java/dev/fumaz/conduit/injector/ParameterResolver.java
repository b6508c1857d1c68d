package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.reflect.ParameterSpec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Supplies values for parameters that were not given explicitly.
 */
@FunctionalInterface
public interface ParameterResolver {

    /**
     * @return the value for {@code parameter}, or {@code null} if this resolver cannot supply one
     */
    @Nullable Object resolve(@NotNull ParameterSpec parameter);

}
