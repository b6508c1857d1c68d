package dev.fumaz.conduit.context;

import dev.fumaz.conduit.annotation.Context;
import dev.fumaz.conduit.container.ConduitContainer;
import dev.fumaz.conduit.exception.UnresolvedParameterException;
import dev.fumaz.conduit.reflect.Invocables;
import dev.fumaz.conduit.reflect.ParameterSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextInjectorTest {

    interface Storage {
        String name();
    }

    static class Report {
        final Storage storage;

        Report(@Context("test") Storage storage) {
            this.storage = storage;
        }
    }

    @Context("test")
    static class TestReport {
        final Storage storage;

        TestReport(Storage storage) {
            this.storage = storage;
        }
    }

    static class DefaultReport {
        final Storage storage;

        DefaultReport(Storage storage) {
            this.storage = storage;
        }
    }

    static class Auditor {
        final Storage storage;

        Auditor(@Context("audit") Storage storage) {
            this.storage = storage;
        }
    }

    private ContextContainer<ConduitContainer> contexts;

    @BeforeEach
    void setUp() {
        contexts = new ContextContainer<>(ConduitContainer::new);
        contexts.getDefault().bind(Storage.class).toInstance(() -> "disk");
        contexts.getDefault().bind(Report.class).toSelf();
        contexts.getDefault().bind(TestReport.class).toSelf();
        contexts.getDefault().bind(DefaultReport.class).toSelf();
        contexts.getDefault().bind(Auditor.class).toSelf();
        contexts.context("test").bind(Storage.class).toInstance(() -> "memory");
    }

    @Test
    void parameterContextSelectsBinding() {
        assertEquals("memory", contexts.get(Report.class).storage.name());
        assertEquals("disk", contexts.get(DefaultReport.class).storage.name());
        assertTrue(contexts.getActiveContexts().isEmpty());
    }

    @Test
    void classContextAppliesToEveryParameter() {
        assertEquals("memory", contexts.get(TestReport.class).storage.name());
    }

    @Test
    void factoriesInsideContextsResolveThroughStack() {
        contexts.context("test").bind(DefaultReport.class).toFactory(Storage.class, DefaultReport::new);

        try (ContextScope ignored = contexts.enter("test")) {
            assertEquals("memory", contexts.get(DefaultReport.class).storage.name());
        }
    }

    @Test
    void declaredContextsArePoppedAfterFailure() {
        contexts.context("audit").bind(Storage.class).toSupplier(() -> {
            throw new IllegalStateException("audit log offline");
        });

        assertThrows(UnresolvedParameterException.class, () -> contexts.get(Auditor.class));
        assertTrue(contexts.getActiveContexts().isEmpty());
    }

    @Test
    void handDeclaredContexts() {
        String name = contexts.getInjector().call(Invocables.function("storageName",
                arguments -> ((Storage) arguments[0]).name(),
                ParameterSpec.of("storage", Storage.class).inContext("test")));

        assertEquals("memory", name);
    }
}
