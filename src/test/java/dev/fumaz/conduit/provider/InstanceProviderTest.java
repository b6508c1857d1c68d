package dev.fumaz.conduit.provider;

import dev.fumaz.conduit.container.ConduitContainer;
import dev.fumaz.conduit.exception.ImplementationException;
import dev.fumaz.conduit.exception.InstanceTypeException;
import dev.fumaz.conduit.injector.Injector;
import dev.fumaz.conduit.reflect.Invocables;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InstanceProviderTest {

    interface Engine {
    }

    static class DieselEngine implements Engine {
    }

    static class Car {
        final Engine engine;
        String plate;

        Car(Engine engine) {
            this.engine = engine;
        }
    }

    @Test
    void fixedInstanceIsCheckedWhenCreated() {
        DieselEngine engine = new DieselEngine();

        assertSame(engine, InstanceProvider.instance(Engine.class, engine).get());
        assertThrows(InstanceTypeException.class, () -> InstanceProvider.instance(Engine.class, null));
        assertThrows(InstanceTypeException.class, () -> InstanceProvider.instance(Engine.class, "diesel"));
    }

    @Test
    void factoryResultIsTypeChecked() {
        Injector injector = new ConduitContainer().getInjector();

        InstanceProvider<Engine> valid = InstanceProvider.factory(Engine.class,
                Invocables.supplier(DieselEngine::new), injector);
        InstanceProvider<Engine> wrongType = InstanceProvider.factory(Engine.class,
                Invocables.supplier(() -> "diesel"), injector);
        InstanceProvider<Engine> missing = InstanceProvider.factory(Engine.class,
                Invocables.supplier(() -> null), injector);

        assertInstanceOf(DieselEngine.class, valid.get());

        InstanceTypeException exception = assertThrows(InstanceTypeException.class, wrongType::get);
        assertSame(String.class, exception.getActualType());
        assertThrows(InstanceTypeException.class, missing::get);
    }

    @Test
    void autowiringRunsMutatorWithNewInstance() {
        ConduitContainer container = new ConduitContainer();
        container.bind(Engine.class).toSupplier(DieselEngine::new);
        container.bind(String.class).toInstance("AB-123");

        ClassInstanceProvider<Car> provider = new ClassInstanceProvider<>(Car.class, container.getInjector(),
                Invocables.consumer(Car.class, String.class, (car, plate) -> car.plate = plate));

        Car car = provider.get();

        assertInstanceOf(DieselEngine.class, car.engine);
        assertEquals("AB-123", car.plate);
    }

    @Test
    void implementationDelegatesToContainer() {
        ConduitContainer container = new ConduitContainer();
        DieselEngine engine = new DieselEngine();
        container.bind(DieselEngine.class).toInstance(engine);

        InstanceProvider<Engine> provider = InstanceProvider.implementation(Engine.class, DieselEngine.class,
                container);

        assertSame(engine, provider.get());
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void implementationMustBeProperSubtype() {
        ConduitContainer container = new ConduitContainer();

        ImplementationException same = assertThrows(ImplementationException.class,
                () -> new ImplementationInstanceProvider<>(Engine.class, Engine.class, container));
        assertSame(Engine.class, same.getImplementation());

        assertThrows(ImplementationException.class,
                () -> new ImplementationInstanceProvider(Engine.class, String.class, container));
    }
}
