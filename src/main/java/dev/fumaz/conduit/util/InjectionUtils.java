package dev.fumaz.conduit.util;

import dev.fumaz.conduit.annotation.Context;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.AnnotatedElement;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class InjectionUtils {

    private InjectionUtils() {
    }

    public static @NotNull List<String> getContexts(@Nullable AnnotatedElement element) {
        if (element == null) {
            return Collections.emptyList();
        }

        Context context = element.getAnnotation(Context.class);

        if (context == null || context.value().length == 0) {
            return Collections.emptyList();
        }

        return Arrays.asList(context.value());
    }
}
