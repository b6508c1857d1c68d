package dev.fumaz.conduit.annotation;

import java.lang.annotation.*;

/**
 * Marks the constructor used for autowiring, or marks a parameter as injectable.
 * A parameter with {@code optional = true} receives {@code null} when it cannot be resolved.
 */
@Target({ElementType.CONSTRUCTOR, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Inject {
    boolean optional() default false;
}
