package dev.fumaz.conduit.lifetime;

import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link LifetimeStrategy} that invokes the factory once and returns the cached instance afterwards.
 * <p>
 * The first creation happens under a lock; later reads only perform an acquiring load.
 *
 * @param <T> the type of the managed instance
 */
public class SingletonStrategy<T> implements LifetimeStrategy<T> {

    private static final Logger LOGGER = Logger.getLogger(SingletonStrategy.class.getName());
    private static final VarHandle INSTANCE_HANDLE;

    static {
        try {
            INSTANCE_HANDLE = MethodHandles.lookup().findVarHandle(SingletonStrategy.class, "instance", Object.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final @NotNull Class<T> type;
    private final Object lock = new Object();
    private T instance;

    public SingletonStrategy(@NotNull Class<T> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public @NotNull T get(@NotNull Supplier<? extends T> factory) {
        T local = getInitializedInstance();

        if (local != null) {
            return local;
        }

        synchronized (lock) {
            local = getInitializedInstance();

            if (local == null) {
                local = factory.get();
                validate(local);
                publish(local);

                LOGGER.log(Level.FINE, "Created singleton {0}", type.getName());
            }

            return local;
        }
    }

    public boolean isInitialized() {
        return getInitializedInstance() != null;
    }

    @SuppressWarnings("unchecked")
    private T getInitializedInstance() {
        return (T) INSTANCE_HANDLE.getAcquire(this);
    }

    private void publish(T value) {
        INSTANCE_HANDLE.setRelease(this, value);
    }

    private void validate(T candidate) {
        if (candidate != null) {
            return;
        }

        throw new IllegalStateException("Singleton of " + type.getName() + " cannot be null");
    }

    @Override
    public String toString() {
        return "singleton " + type.getName();
    }
}
