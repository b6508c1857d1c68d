package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.reflect.Invocable;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.Map;

/**
 * An {@link Injector} calls functions and constructors, supplying their parameters.
 * <p>
 * Explicit arguments are keyed either by parameter name ({@link String}) or by position ({@link Integer}); the
 * name takes precedence. Parameters without an explicit argument are resolved by the injector.
 */
public interface Injector {

    <R> R call(@NotNull Invocable<R> invocable, @NotNull Map<?, ?> arguments);

    <T> @NotNull T instantiate(@NotNull Class<T> type, @NotNull Map<?, ?> arguments);

    default <R> R call(@NotNull Invocable<R> invocable) {
        return call(invocable, Collections.emptyMap());
    }

    default <T> @NotNull T instantiate(@NotNull Class<T> type) {
        return instantiate(type, Collections.emptyMap());
    }

}
