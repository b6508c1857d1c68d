package dev.fumaz.conduit.container;

import dev.fumaz.conduit.exception.CircularDependencyException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tracks the types a container is resolving on each thread. Requesting a type that is already in progress on the
 * same thread is a cycle.
 */
final class ResolutionFrames {

    private final ThreadLocal<State> state = new ThreadLocal<>();

    /**
     * @throws CircularDependencyException if the type is already being resolved on this thread
     */
    void begin(@NotNull Class<?> type) {
        State current = state.get();

        if (current == null) {
            current = new State();
            state.set(current);
        }

        if (current.inProgress.contains(type)) {
            throw cycle(current, type);
        }

        current.path.push(type);
        current.inProgress.add(type);
    }

    void end(@NotNull Class<?> type) {
        State current = state.get();

        if (current == null || current.path.isEmpty()) {
            throw new IllegalStateException("No resolution in progress for " + type.getName());
        }

        Class<?> finished = current.path.pop();
        current.inProgress.remove(finished);

        if (current.path.isEmpty()) {
            state.remove();
        }

        if (finished != type) {
            throw new IllegalStateException("Resolution stack mismatch for " + type.getName());
        }
    }

    private static CircularDependencyException cycle(State state, Class<?> type) {
        List<Class<?>> ordered = new ArrayList<>(state.path);
        Collections.reverse(ordered);

        int startIndex = ordered.indexOf(type);
        List<Class<?>> cyclePath = new ArrayList<>(ordered.subList(Math.max(startIndex, 0), ordered.size()));
        cyclePath.add(type);

        return new CircularDependencyException(type, cyclePath);
    }

    private static final class State {
        private final Deque<Class<?>> path = new ArrayDeque<>();
        private final Set<Class<?>> inProgress = new HashSet<>();
    }
}
