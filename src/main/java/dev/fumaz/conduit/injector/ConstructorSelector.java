package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.annotation.Inject;
import dev.fumaz.conduit.exception.ConfigurationException;
import dev.fumaz.conduit.reflect.Invocable;
import dev.fumaz.conduit.reflect.Invocables;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

/**
 * Picks the constructor used to autowire a class and caches the choice per class.
 * <p>
 * Order of preference: the constructor annotated with {@link Inject}, the no-argument constructor, the only
 * declared constructor.
 */
final class ConstructorSelector {

    private static final ClassValue<Selection> SELECTIONS = new ClassValue<>() {
        @Override
        protected Selection computeValue(Class<?> type) {
            return Selection.of(type);
        }
    };

    private ConstructorSelector() {
    }

    static boolean isInstantiable(@NotNull Class<?> type) {
        int modifiers = type.getModifiers();

        return !type.isPrimitive()
                && !type.isArray()
                && !type.isInterface()
                && !type.isEnum()
                && !Modifier.isAbstract(modifiers);
    }

    /**
     * @throws ConfigurationException if the type is not instantiable or has no unambiguous constructor
     */
    @SuppressWarnings("unchecked")
    static <T> @NotNull Invocable<T> select(@NotNull Class<T> type) {
        return (Invocable<T>) SELECTIONS.get(type).get();
    }

    private static final class Selection {

        private final @Nullable Invocable<?> constructor;
        private final @Nullable String failure;

        private Selection(@Nullable Invocable<?> constructor, @Nullable String failure) {
            this.constructor = constructor;
            this.failure = failure;
        }

        private static Selection of(Class<?> type) {
            if (!isInstantiable(type)) {
                return failed(type.getName() + " is not a concrete class");
            }

            Constructor<?>[] declaredConstructors = type.getDeclaredConstructors();
            Constructor<?> injectableCandidate = null;
            Constructor<?> zeroArgCandidate = null;

            for (Constructor<?> constructor : declaredConstructors) {
                if (constructor.isAnnotationPresent(Inject.class)) {
                    if (injectableCandidate != null) {
                        return failed("Multiple injectable constructors found for " + type.getName());
                    }

                    injectableCandidate = constructor;
                }

                if (constructor.getParameterCount() == 0) {
                    zeroArgCandidate = constructor;
                }
            }

            Constructor<?> selected = injectableCandidate;

            if (selected == null) {
                if (zeroArgCandidate != null) {
                    selected = zeroArgCandidate;
                } else if (declaredConstructors.length == 1) {
                    selected = declaredConstructors[0];
                }
            }

            if (selected == null) {
                return failed("No unambiguous constructor found for " + type.getName()
                        + "; annotate one with @" + Inject.class.getSimpleName());
            }

            return new Selection(Invocables.constructor(selected), null);
        }

        private static Selection failed(String message) {
            return new Selection(null, message);
        }

        private Invocable<?> get() {
            if (constructor == null) {
                throw new ConfigurationException(failure);
            }

            return constructor;
        }
    }
}
