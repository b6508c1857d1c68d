package dev.fumaz.conduit.container;

import dev.fumaz.conduit.exception.CircularDependencyException;
import dev.fumaz.conduit.exception.InstanceTypeException;
import dev.fumaz.conduit.exception.UnresolvedClassException;
import dev.fumaz.conduit.lifetime.Lifetime;
import dev.fumaz.conduit.reflect.Invocables;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NamespaceContainerTest {

    private static final String PACKAGE = NamespaceContainerTest.class.getPackageName();

    static class Gateway {
        final Handler handler;

        Gateway(Handler handler) {
            this.handler = handler;
        }
    }

    static class Handler {
        String origin = "autowired";
    }

    static class Ping {
        Ping(Pong pong) {
        }
    }

    static class Pong {
        Pong(Ping ping) {
        }
    }

    @Test
    void matchesPackageAndSubpackages() {
        NamespaceContainer container = new NamespaceContainer("dev.fumaz");

        assertTrue(container.has(Gateway.class));
        assertFalse(container.has(String.class));
        assertFalse(new NamespaceContainer("dev.fumaz.cond").has(Gateway.class));
    }

    @Test
    void trailingDotIsIgnored() {
        NamespaceContainer container = new NamespaceContainer(PACKAGE + ".");

        assertEquals(PACKAGE, container.getPrefix());
        assertTrue(container.has(Gateway.class));
        assertTrue(new NamespaceContainer(".").has(String.class));
    }

    @Test
    void emptyPrefixMatchesEverything() {
        NamespaceContainer container = new NamespaceContainer("");

        assertTrue(container.has(String.class));
        assertTrue(container.has(Gateway.class));
    }

    @Test
    void autowiresFromItself() {
        NamespaceContainer container = new NamespaceContainer(PACKAGE);

        Gateway gateway = container.get(Gateway.class);

        assertEquals("autowired", gateway.handler.origin);
    }

    @Test
    void unsupportedTypeIsUnresolved() {
        NamespaceContainer container = new NamespaceContainer(PACKAGE);

        assertThrows(UnresolvedClassException.class, () -> container.get(String.class));
    }

    @Test
    void detectsCyclesWithoutParent() {
        NamespaceContainer container = new NamespaceContainer(PACKAGE);

        CircularDependencyException exception = assertThrows(CircularDependencyException.class,
                () -> container.get(Ping.class));

        assertSame(Ping.class, exception.getType());
    }

    @Test
    void customFactoryReceivesRequestedClass() {
        ConduitContainer container = new ConduitContainer();
        container.addNamespace(PACKAGE, Lifetime.SINGLETON, Invocables.of(Class.class, type -> {
            if (type == Handler.class) {
                Handler handler = new Handler();
                handler.origin = "factory";
                return handler;
            }

            return null;
        }));

        Handler handler = container.get(Handler.class);

        assertEquals("factory", handler.origin);
        assertSame(handler, container.get(Handler.class));
        assertThrows(InstanceTypeException.class, () -> container.get(Gateway.class));
    }

    @Test
    void nestedInParentUsesParentInjector() {
        ConduitContainer container = new ConduitContainer();
        Handler handler = new Handler();
        container.bind(Handler.class).toInstance(handler);
        container.addNamespace(PACKAGE, Lifetime.TRANSIENT);

        Gateway first = container.get(Gateway.class);
        Gateway second = container.get(Gateway.class);

        assertNotSame(first, second);
        assertSame(handler, first.handler);
    }
}
