package dev.fumaz.conduit.container;

import dev.fumaz.conduit.exception.ConfigurationException;
import dev.fumaz.conduit.injector.Injector;
import dev.fumaz.conduit.reflect.Invocable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.util.Map;
import java.util.Objects;

/**
 * Provides every class carrying an annotation. A factory receives the annotation as argument {@code 1}.
 */
public class AnnotationContainer extends AutowiringContainer {

    private final @NotNull Class<? extends Annotation> annotationType;

    public AnnotationContainer(@NotNull Class<? extends Annotation> annotationType) {
        this(annotationType, null, null);
    }

    /**
     * @throws ConfigurationException if the annotation is not retained at runtime
     */
    public AnnotationContainer(@NotNull Class<? extends Annotation> annotationType,
                               @Nullable Injector injector,
                               @Nullable Invocable<?> factory) {
        super(injector, factory);
        this.annotationType = Objects.requireNonNull(annotationType, "annotationType");

        Retention retention = annotationType.getAnnotation(Retention.class);

        if (retention == null || retention.value() != RetentionPolicy.RUNTIME) {
            throw new ConfigurationException("@" + annotationType.getName()
                    + " must be retained at runtime to be matched");
        }
    }

    @Override
    public boolean has(@NotNull Class<?> type) {
        return type.isAnnotationPresent(annotationType);
    }

    @Override
    protected @NotNull Map<Object, Object> factoryArguments(@NotNull Class<?> type) {
        Map<Object, Object> arguments = super.factoryArguments(type);
        arguments.put(1, type.getAnnotation(annotationType));

        return arguments;
    }

    public @NotNull Class<? extends Annotation> getAnnotationType() {
        return annotationType;
    }

    @Override
    public String toString() {
        return "classes annotated with @" + annotationType.getSimpleName();
    }

}
