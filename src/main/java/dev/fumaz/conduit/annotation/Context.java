package dev.fumaz.conduit.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the contexts that are pushed onto a {@link dev.fumaz.conduit.context.ContextContainer} while the
 * parameters of the annotated element are resolved.
 * <p>
 * Contexts declared on a class apply to all its constructors and methods, contexts declared on a constructor or
 * method apply to all its parameters. The most specific declaration is searched first.
 */
@Target({ElementType.TYPE, ElementType.CONSTRUCTOR, ElementType.METHOD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Context {

    /**
     * Context names, pushed in declaration order.
     */
    String[] value();
}
