package dev.fumaz.conduit.container;

import dev.fumaz.conduit.injector.Injector;
import dev.fumaz.conduit.reflect.Invocable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Provides every class inside a package and its subpackages. An empty prefix matches every class.
 */
public class NamespaceContainer extends AutowiringContainer {

    private final @NotNull String prefix;

    public NamespaceContainer(@NotNull String prefix) {
        this(prefix, null, null);
    }

    public NamespaceContainer(@NotNull String prefix, @Nullable Injector injector, @Nullable Invocable<?> factory) {
        super(injector, factory);
        this.prefix = normalize(Objects.requireNonNull(prefix, "prefix"));
    }

    @Override
    public boolean has(@NotNull Class<?> type) {
        return prefix.isEmpty() || type.getName().startsWith(prefix + ".");
    }

    /**
     * The package name without trailing dots; an empty string is the root namespace.
     */
    public @NotNull String getPrefix() {
        return prefix;
    }

    private static String normalize(String prefix) {
        int end = prefix.length();

        while (end > 0 && prefix.charAt(end - 1) == '.') {
            end--;
        }

        return prefix.substring(0, end);
    }

    @Override
    public String toString() {
        return "namespace " + (prefix.isEmpty() ? "<root>" : prefix);
    }

}
