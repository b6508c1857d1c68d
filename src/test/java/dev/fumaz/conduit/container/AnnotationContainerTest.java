package dev.fumaz.conduit.container;

import dev.fumaz.conduit.exception.ConfigurationException;
import dev.fumaz.conduit.lifetime.Lifetime;
import dev.fumaz.conduit.reflect.Invocables;
import org.junit.jupiter.api.Test;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnnotationContainerTest {

    @Retention(RetentionPolicy.RUNTIME)
    @interface Component {
        String value() default "";
    }

    @Retention(RetentionPolicy.CLASS)
    @interface Invisible {
    }

    @Component("greeter")
    static class Greeter {
        String label = "autowired";
    }

    static class Plain {
    }

    @Test
    void matchesAnnotatedTypes() {
        AnnotationContainer container = new AnnotationContainer(Component.class);

        assertTrue(container.has(Greeter.class));
        assertFalse(container.has(Plain.class));
        assertNotNull(container.get(Greeter.class));
    }

    @Test
    void requiresRuntimeRetention() {
        assertThrows(ConfigurationException.class, () -> new AnnotationContainer(Invisible.class));
    }

    @Test
    void factoryReceivesAnnotation() {
        ConduitContainer container = new ConduitContainer();
        container.addAnnotation(Component.class, Lifetime.TRANSIENT,
                Invocables.of(Class.class, Component.class, (type, component) -> {
                    Greeter greeter = new Greeter();
                    greeter.label = component.value();
                    return greeter;
                }));

        assertEquals("greeter", container.get(Greeter.class).label);
    }

    @Test
    void defaultFactoryAutowires() {
        ConduitContainer container = new ConduitContainer();
        container.addAnnotation(Component.class, Lifetime.TRANSIENT);

        assertEquals("autowired", container.get(Greeter.class).label);
    }
}
