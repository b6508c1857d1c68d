package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.exception.CircularException;
import dev.fumaz.conduit.exception.CircularParameterException;
import dev.fumaz.conduit.exception.ConduitException;
import dev.fumaz.conduit.exception.ConfigurationException;
import dev.fumaz.conduit.exception.ProvisionException;
import dev.fumaz.conduit.exception.UnresolvedClassException;
import dev.fumaz.conduit.exception.UnresolvedParameterException;
import dev.fumaz.conduit.reflect.Invocable;
import dev.fumaz.conduit.reflect.ParameterSpec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The default {@link Injector}. Parameters are taken from the explicit arguments, then from a
 * {@link ParameterResolver}, then from their declared default, then {@code null} if they accept it.
 */
public class ConduitInjector implements Injector {

    private static final Logger LOGGER = Logger.getLogger(ConduitInjector.class.getName());
    private static final Object[] NO_ARGUMENTS = new Object[0];

    private final @NotNull ParameterResolver resolver;

    public ConduitInjector(@NotNull ParameterResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public <R> R call(@NotNull Invocable<R> invocable, @NotNull Map<?, ?> arguments) {
        Objects.requireNonNull(invocable, "invocable");
        Objects.requireNonNull(arguments, "arguments");

        Object[] resolved = resolveArguments(invocable, arguments);

        return invoke(invocable, resolved);
    }

    @Override
    public <T> @NotNull T instantiate(@NotNull Class<T> type, @NotNull Map<?, ?> arguments) {
        Objects.requireNonNull(type, "type");

        Invocable<T> constructor;

        try {
            constructor = ConstructorSelector.select(type);
        } catch (ConfigurationException e) {
            throw new UnresolvedClassException(type, e);
        }

        return call(constructor, arguments);
    }

    /**
     * Resolves a parameter that was not given explicitly.
     *
     * @return the value, or {@code null} if the parameter cannot be resolved
     */
    protected @Nullable Object resolveParameter(@NotNull ParameterSpec parameter) {
        return resolver.resolve(parameter);
    }

    private Object[] resolveArguments(Invocable<?> invocable, Map<?, ?> arguments) {
        List<ParameterSpec> parameters = invocable.getParameters();

        if (parameters.isEmpty()) {
            return NO_ARGUMENTS;
        }

        ExplicitArguments explicit = ExplicitArguments.of(arguments);
        Object[] resolved = new Object[parameters.size()];

        for (int i = 0; i < resolved.length; i++) {
            ParameterSpec parameter = parameters.get(i);

            if (explicit.byName.containsKey(parameter.getName())) {
                resolved[i] = explicit.byName.get(parameter.getName());
            } else if (explicit.byIndex.containsKey(i)) {
                resolved[i] = explicit.byIndex.get(i);
            } else {
                resolved[i] = resolveMissing(invocable, parameter);
            }
        }

        return resolved;
    }

    private @Nullable Object resolveMissing(Invocable<?> invocable, ParameterSpec parameter) {
        Object value;

        try {
            value = resolveParameter(parameter);
        } catch (ConduitException e) {
            if (e instanceof CircularException) {
                throw new CircularParameterException(invocable.getName(), parameter.getName(), parameter.getType(),
                        (CircularException) e);
            }

            throw new UnresolvedParameterException(invocable.getName(), parameter.getName(), parameter.getType(), e);
        }

        if (value != null) {
            return value;
        }

        if (parameter.hasDefault()) {
            return parameter.getDefaultValue();
        }

        if (parameter.isNullable()) {
            return null;
        }

        throw new UnresolvedParameterException(invocable.getName(), parameter.getName(), parameter.getType());
    }

    private <R> R invoke(Invocable<R> invocable, Object[] arguments) {
        try {
            return invocable.invoke(arguments);
        } catch (ConduitException | Error e) {
            throw e;
        } catch (Throwable throwable) {
            Throwable cause = unwrap(throwable);
            String message = "Failed to invoke " + invocable.getName();

            LOGGER.log(Level.FINE, message, cause);
            throw new ProvisionException(message, cause);
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        if (throwable instanceof InvocationTargetException) {
            Throwable target = ((InvocationTargetException) throwable).getTargetException();
            return target != null ? target : throwable;
        }

        return throwable;
    }

    /**
     * Explicit arguments split by key type. Keys that are neither names nor positions are ignored. The caller's
     * map is only iterated, never queried by key.
     */
    private static final class ExplicitArguments {

        private static final ExplicitArguments EMPTY = new ExplicitArguments(Collections.emptyMap(),
                Collections.emptyMap());

        private final Map<String, Object> byName;
        private final Map<Integer, Object> byIndex;

        private ExplicitArguments(Map<String, Object> byName, Map<Integer, Object> byIndex) {
            this.byName = byName;
            this.byIndex = byIndex;
        }

        private static ExplicitArguments of(Map<?, ?> arguments) {
            if (arguments.isEmpty()) {
                return EMPTY;
            }

            Map<String, Object> byName = new HashMap<>();
            Map<Integer, Object> byIndex = new HashMap<>();

            for (Map.Entry<?, ?> entry : arguments.entrySet()) {
                Object key = entry.getKey();

                if (key instanceof String) {
                    byName.put((String) key, entry.getValue());
                } else if (key instanceof Integer) {
                    byIndex.put((Integer) key, entry.getValue());
                }
            }

            return new ExplicitArguments(byName, byIndex);
        }
    }
}
