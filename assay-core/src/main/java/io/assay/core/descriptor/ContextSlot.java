package io.assay.core.descriptor;

import java.lang.reflect.Method;
import java.util.Objects;

/// A property through which a test instance receives its case context.
///
/// @param name property name, not null
/// @param setter instance method taking the context, null when the slot is read-only
public record ContextSlot(String name, Method setter) {

    public ContextSlot {
        Objects.requireNonNull(name, "name");
    }

    public boolean isWritable() {
        return setter != null;
    }
}
