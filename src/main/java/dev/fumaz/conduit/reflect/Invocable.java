package dev.fumaz.conduit.reflect;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Something an {@link dev.fumaz.conduit.injector.Injector} can call: a constructor, a method or a function whose
 * parameters are declared explicitly.
 *
 * @param <R> the result type
 */
public interface Invocable<R> {

    /**
     * @return a human readable name used in error messages
     */
    @NotNull String getName();

    @NotNull List<ParameterSpec> getParameters();

    /**
     * Invokes the callable with one argument per declared parameter.
     *
     * @throws Throwable anything thrown by the underlying code, unwrapped
     */
    R invoke(@NotNull Object[] arguments) throws Throwable;

}
