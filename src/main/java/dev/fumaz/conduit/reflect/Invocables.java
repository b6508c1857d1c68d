package dev.fumaz.conduit.reflect;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Factories for {@link Invocable}s.
 * <p>
 * Constructors and methods are described through reflection. Lambdas cannot be introspected, so their parameters
 * are declared alongside them, either as classes or as {@link ParameterSpec}s.
 */
public final class Invocables {

    private static final MethodHandles.Lookup ROOT_LOOKUP = MethodHandles.lookup();
    private static final ConcurrentMap<Class<?>, MethodHandles.Lookup> PRIVATE_LOOKUPS = new ConcurrentHashMap<>();

    private Invocables() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static <T> @NotNull Invocable<T> constructor(@NotNull Constructor<T> constructor) {
        Objects.requireNonNull(constructor, "constructor");

        MethodHandle handle = spread(unreflectConstructor(constructor), constructor.getParameterCount());
        String name = "constructor " + constructor.toGenericString();

        return new HandleInvocable<>(name, describe(constructor), handle);
    }

    public static @NotNull Invocable<Object> method(@NotNull Method method, @Nullable Object target) {
        Objects.requireNonNull(method, "method");

        boolean isStatic = Modifier.isStatic(method.getModifiers());

        if (!isStatic && target == null) {
            throw new ReflectionException("Instance method " + method.toGenericString() + " requires a target");
        }

        if (!isStatic && !method.getDeclaringClass().isInstance(target)) {
            throw new ReflectionException(target.getClass().getName() + " does not declare "
                    + method.toGenericString());
        }

        MethodHandle handle = unreflectMethod(method);

        if (!isStatic) {
            handle = handle.bindTo(target);
        }

        return new HandleInvocable<>("method " + method.toGenericString(), describe(method),
                spread(handle, method.getParameterCount()));
    }

    public static @NotNull Invocable<Object> method(@NotNull Class<?> owner, @NotNull String name,
                                                    @Nullable Object target) {
        List<Method> candidates = Arrays.stream(owner.getDeclaredMethods())
                .filter(method -> method.getName().equals(name))
                .filter(method -> !method.isSynthetic())
                .collect(Collectors.toList());

        if (candidates.size() != 1) {
            throw new ReflectionException("Expected exactly one method named " + name + " in " + owner.getName()
                    + " but found " + candidates.size());
        }

        return method(candidates.get(0), target);
    }

    public static <R> @NotNull Invocable<R> function(@NotNull String name,
                                                     @NotNull Function<Object[], ? extends R> body,
                                                     @NotNull ParameterSpec... parameters) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");

        return new FunctionInvocable<>(name, Collections.unmodifiableList(new ArrayList<>(Arrays.asList(parameters))),
                body);
    }

    public static <R> @NotNull Invocable<R> supplier(@NotNull Supplier<? extends R> supplier) {
        Objects.requireNonNull(supplier, "supplier");

        return function("supplier", arguments -> supplier.get());
    }

    @SuppressWarnings("unchecked")
    public static <A, R> @NotNull Invocable<R> of(@NotNull Class<A> first,
                                                  @NotNull Function<? super A, ? extends R> function) {
        Objects.requireNonNull(function, "function");

        return function(signature("function", first),
                arguments -> function.apply((A) arguments[0]),
                parameter(0, first));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, R> @NotNull Invocable<R> of(@NotNull Class<A> first,
                                                     @NotNull Class<B> second,
                                                     @NotNull BiFunction<? super A, ? super B, ? extends R> function) {
        Objects.requireNonNull(function, "function");

        return function(signature("function", first, second),
                arguments -> function.apply((A) arguments[0], (B) arguments[1]),
                parameter(0, first), parameter(1, second));
    }

    @SuppressWarnings("unchecked")
    public static <A> @NotNull Invocable<Void> consumer(@NotNull Class<A> first,
                                                       @NotNull Consumer<? super A> consumer) {
        Objects.requireNonNull(consumer, "consumer");

        return function(signature("consumer", first),
                arguments -> {
                    consumer.accept((A) arguments[0]);
                    return null;
                },
                parameter(0, first));
    }

    @SuppressWarnings("unchecked")
    public static <A, B> @NotNull Invocable<Void> consumer(@NotNull Class<A> first,
                                                          @NotNull Class<B> second,
                                                          @NotNull BiConsumer<? super A, ? super B> consumer) {
        Objects.requireNonNull(consumer, "consumer");

        return function(signature("consumer", first, second),
                arguments -> {
                    consumer.accept((A) arguments[0], (B) arguments[1]);
                    return null;
                },
                parameter(0, first), parameter(1, second));
    }

    private static ParameterSpec parameter(int index, Class<?> type) {
        return ParameterSpec.of("arg" + index, Objects.requireNonNull(type, "type"));
    }

    private static String signature(String kind, Class<?>... types) {
        return Arrays.stream(types)
                .map(Class::getSimpleName)
                .collect(Collectors.joining(", ", kind + "(", ")"));
    }

    private static List<ParameterSpec> describe(Executable executable) {
        Parameter[] parameters = executable.getParameters();

        if (parameters.length == 0) {
            return Collections.emptyList();
        }

        List<ParameterSpec> specs = new ArrayList<>(parameters.length);

        for (Parameter parameter : parameters) {
            specs.add(ParameterSpec.of(parameter));
        }

        return Collections.unmodifiableList(specs);
    }

    private static MethodHandles.Lookup lookupFor(Class<?> type) {
        return PRIVATE_LOOKUPS.computeIfAbsent(type, Invocables::createLookupFor);
    }

    private static MethodHandles.Lookup createLookupFor(Class<?> type) {
        try {
            return MethodHandles.privateLookupIn(type, ROOT_LOOKUP);
        } catch (IllegalAccessException | RuntimeException e) {
            return ROOT_LOOKUP;
        }
    }

    private static MethodHandle unreflectConstructor(Constructor<?> constructor) {
        constructor.trySetAccessible();

        try {
            return lookupFor(constructor.getDeclaringClass()).unreflectConstructor(constructor);
        } catch (IllegalAccessException firstFailure) {
            try {
                return ROOT_LOOKUP.unreflectConstructor(constructor);
            } catch (IllegalAccessException secondFailure) {
                ReflectionException exception = new ReflectionException(
                        "Unable to access constructor handle for " + constructor, secondFailure);
                exception.addSuppressed(firstFailure);
                throw exception;
            }
        }
    }

    private static MethodHandle unreflectMethod(Method method) {
        method.trySetAccessible();

        try {
            return lookupFor(method.getDeclaringClass()).unreflect(method);
        } catch (IllegalAccessException firstFailure) {
            try {
                return ROOT_LOOKUP.unreflect(method);
            } catch (IllegalAccessException secondFailure) {
                ReflectionException exception = new ReflectionException(
                        "Unable to access method handle for " + method, secondFailure);
                exception.addSuppressed(firstFailure);
                throw exception;
            }
        }
    }

    private static MethodHandle spread(MethodHandle handle, int parameterCount) {
        return handle.asSpreader(Object[].class, parameterCount)
                .asType(MethodType.methodType(Object.class, Object[].class));
    }

    private static final class HandleInvocable<R> implements Invocable<R> {

        private final String name;
        private final List<ParameterSpec> parameters;
        private final MethodHandle handle;

        private HandleInvocable(String name, List<ParameterSpec> parameters, MethodHandle handle) {
            this.name = name;
            this.parameters = parameters;
            this.handle = handle;
        }

        @Override
        public @NotNull String getName() {
            return name;
        }

        @Override
        public @NotNull List<ParameterSpec> getParameters() {
            return parameters;
        }

        @Override
        @SuppressWarnings("unchecked")
        public R invoke(@NotNull Object[] arguments) throws Throwable {
            Object result = handle.invoke(arguments);
            return (R) result;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class FunctionInvocable<R> implements Invocable<R> {

        private final String name;
        private final List<ParameterSpec> parameters;
        private final Function<Object[], ? extends R> body;

        private FunctionInvocable(String name, List<ParameterSpec> parameters, Function<Object[], ? extends R> body) {
            this.name = name;
            this.parameters = parameters;
            this.body = body;
        }

        @Override
        public @NotNull String getName() {
            return name;
        }

        @Override
        public @NotNull List<ParameterSpec> getParameters() {
            return parameters;
        }

        @Override
        public R invoke(@NotNull Object[] arguments) {
            return body.apply(arguments);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
