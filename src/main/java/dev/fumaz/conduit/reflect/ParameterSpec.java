package dev.fumaz.conduit.reflect;

import dev.fumaz.conduit.annotation.Inject;
import dev.fumaz.conduit.util.InjectionUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Executable;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes one declared parameter of an {@link Invocable}: its name, declared type, whether it accepts
 * {@code null}, its default value and the contexts under which it is resolved.
 * <p>
 * Instances are immutable; the {@code with*} style methods return modified copies.
 */
public final class ParameterSpec {

    private final @NotNull String name;
    private final @NotNull Class<?> type;
    private final boolean nullable;
    private final boolean hasDefault;
    private final @Nullable Object defaultValue;
    private final @NotNull List<String> contexts;

    private ParameterSpec(@NotNull String name,
                          @NotNull Class<?> type,
                          boolean nullable,
                          boolean hasDefault,
                          @Nullable Object defaultValue,
                          @NotNull List<String> contexts) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.nullable = nullable;
        this.hasDefault = hasDefault;
        this.defaultValue = defaultValue;
        this.contexts = contexts;
    }

    public static @NotNull ParameterSpec of(@NotNull String name, @NotNull Class<?> type) {
        return new ParameterSpec(name, type, false, false, null, Collections.emptyList());
    }

    public static @NotNull ParameterSpec of(@NotNull Parameter parameter) {
        Executable executable = parameter.getDeclaringExecutable();
        List<String> contexts = new ArrayList<>();

        contexts.addAll(InjectionUtils.getContexts(executable.getDeclaringClass()));
        contexts.addAll(InjectionUtils.getContexts(executable));
        contexts.addAll(InjectionUtils.getContexts(parameter));

        Inject inject = parameter.getAnnotation(Inject.class);
        boolean nullable = !parameter.getType().isPrimitive() && inject != null && inject.optional();

        return new ParameterSpec(parameter.getName(), parameter.getType(), nullable, false, null,
                contexts.isEmpty() ? Collections.emptyList() : Collections.unmodifiableList(contexts));
    }

    public @NotNull ParameterSpec nullable() {
        if (type.isPrimitive()) {
            throw new IllegalArgumentException("Parameter " + name + " of primitive type " + type.getName()
                    + " cannot accept null");
        }

        return new ParameterSpec(name, type, true, hasDefault, defaultValue, contexts);
    }

    public @NotNull ParameterSpec withDefault(@Nullable Object value) {
        return new ParameterSpec(name, type, nullable, true, value, contexts);
    }

    public @NotNull ParameterSpec inContext(@NotNull String... names) {
        List<String> merged = new ArrayList<>(contexts);
        merged.addAll(Arrays.asList(names));

        return new ParameterSpec(name, type, nullable, hasDefault, defaultValue, Collections.unmodifiableList(merged));
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull Class<?> getType() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public @Nullable Object getDefaultValue() {
        return defaultValue;
    }

    /**
     * @return the contexts to activate while resolving this parameter, least specific first
     */
    public @NotNull List<String> getContexts() {
        return contexts;
    }

    @Override
    public String toString() {
        return type.getName() + " " + name;
    }
}
