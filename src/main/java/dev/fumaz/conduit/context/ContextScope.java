package dev.fumaz.conduit.context;

import org.jetbrains.annotations.NotNull;

/**
 * The contexts entered by {@link ContextContainer#enter(String...)}. Closing the scope pops exactly those
 * contexts; closing it again does nothing.
 */
public final class ContextScope implements AutoCloseable {

    private final @NotNull ContextContainer<?> container;
    private final int count;
    private boolean closed;

    ContextScope(@NotNull ContextContainer<?> container, int count) {
        this.container = container;
        this.count = count;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }

        closed = true;

        for (int i = 0; i < count; i++) {
            container.pop();
        }
    }
}
