package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.annotation.Inject;
import dev.fumaz.conduit.container.ConduitContainer;
import dev.fumaz.conduit.exception.ConfigurationException;
import dev.fumaz.conduit.exception.UnresolvedClassException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConstructorResolutionTest {

    static class Dependency {
    }

    static class Menu {
        private final Dependency dependency;

        Menu(Dependency dependency) {
            this.dependency = dependency;
        }
    }

    static class ParentMenu {
    }

    static class OnlineAccount {
    }

    static class AllowsNullParent {
        private final OnlineAccount account;
        private final ParentMenu parent;

        AllowsNullParent(OnlineAccount account, ParentMenu parent) {
            this.account = account;
            this.parent = parent;
        }
    }

    static class OptionalParent {
        private final Dependency dependency;
        private final ParentMenu parent;

        OptionalParent(Dependency dependency, @Inject(optional = true) ParentMenu parent) {
            this.dependency = dependency;
            this.parent = parent;
        }
    }

    static class AnnotatedChoice {
        private final String source;

        AnnotatedChoice() {
            this.source = "no-arg";
        }

        @Inject
        AnnotatedChoice(Dependency dependency) {
            this.source = "inject";
        }
    }

    static class NoArgChoice {
        private final String source;

        NoArgChoice() {
            this.source = "no-arg";
        }

        NoArgChoice(Dependency dependency) {
            this.source = "dependency";
        }
    }

    static class TwoInjectable {
        @Inject
        TwoInjectable(Dependency dependency) {
        }

        @Inject
        TwoInjectable(Menu menu) {
        }
    }

    static class Ambiguous {
        Ambiguous(Dependency dependency) {
        }

        Ambiguous(Menu menu) {
        }
    }

    abstract static class AbstractMenu {
    }

    private final ConduitContainer container = new ConduitContainer();

    ConstructorResolutionTest() {
        container.bind(Dependency.class).toSelf();
        container.bind(Menu.class).toSelf();
    }

    @Test
    void constructsTypeWithSingleConstructorDependency() {
        Menu menu = container.getInjector().instantiate(Menu.class);

        assertNotNull(menu.dependency);
    }

    @Test
    void respectsExplicitNullArguments() {
        OnlineAccount account = new OnlineAccount();
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("account", account);
        arguments.put("parent", null);

        AllowsNullParent instance = container.getInjector().instantiate(AllowsNullParent.class, arguments);

        assertSame(account, instance.account);
        assertNull(instance.parent);
    }

    @Test
    void optionalParameterResolvesToNull() {
        OptionalParent instance = container.getInjector().instantiate(OptionalParent.class);

        assertNotNull(instance.dependency);
        assertNull(instance.parent);
    }

    @Test
    void prefersInjectAnnotatedConstructor() {
        assertEquals("inject", container.getInjector().instantiate(AnnotatedChoice.class).source);
    }

    @Test
    void prefersNoArgConstructorOverOthers() {
        assertEquals("no-arg", container.getInjector().instantiate(NoArgChoice.class).source);
    }

    @Test
    void rejectsMultipleInjectableConstructors() {
        UnresolvedClassException exception = assertThrows(UnresolvedClassException.class,
                () -> container.getInjector().instantiate(TwoInjectable.class));

        assertInstanceOf(ConfigurationException.class, exception.getConsolidatedException());
        assertTrue(exception.getMessage().contains("Multiple injectable constructors"));
    }

    @Test
    void rejectsAmbiguousConstructors() {
        assertThrows(ConfigurationException.class, () -> ConstructorSelector.select(Ambiguous.class));
        assertThrows(UnresolvedClassException.class, () -> container.getInjector().instantiate(Ambiguous.class));
    }

    @Test
    void rejectsTypesThatCannotBeInstantiated() {
        assertThrows(UnresolvedClassException.class, () -> container.getInjector().instantiate(Runnable.class));
        assertThrows(UnresolvedClassException.class, () -> container.getInjector().instantiate(AbstractMenu.class));
        assertThrows(UnresolvedClassException.class, () -> container.getInjector().instantiate(String[].class));
    }

    @Test
    void selectionIsCached() {
        assertSame(ConstructorSelector.select(Menu.class), ConstructorSelector.select(Menu.class));
    }
}
