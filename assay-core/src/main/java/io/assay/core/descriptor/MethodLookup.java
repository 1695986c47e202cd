package io.assay.core.descriptor;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Comparator;

/// Finds methods by name for binding tables assembled in code.
final class MethodLookup {

    private MethodLookup() {}

    /// Returns the method named `name` declared by `type` itself.
    ///
    /// When overloads exist the one with the most parameters is returned.
    ///
    /// @throws IllegalArgumentException if `type` declares no such method
    static Method declared(Class<?> type, String name) {
        return Arrays.stream(type.getDeclaredMethods())
                .filter(m -> m.getName().equals(name) && !m.isSynthetic())
                .max(Comparator.comparingInt(Method::getParameterCount))
                .orElseThrow(
                        () ->
                                new IllegalArgumentException(
                                        "Method not found: " + type.getName() + "." + name));
    }
}
