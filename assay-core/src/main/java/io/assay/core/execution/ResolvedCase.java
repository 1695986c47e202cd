package io.assay.core.execution;

import io.assay.core.descriptor.TestMethodDefinition;
import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.lifecycle.BoundLifecycle;
import java.util.Optional;

/// A descriptor resolved against the metadata resolver and the lifecycle registry.
///
/// A resolved case is either runnable, with every component present, or terminal,
/// carrying the verdict every expansion of the descriptor reports without running.
///
/// @param descriptor the descriptor, not null
/// @param type resolved test class, null when it could not be found
/// @param definition resolved method definition, null when it could not be found
/// @param lifecycle bound lifecycle, null unless runnable
/// @param terminal verdict that replaces execution, null when runnable
public record ResolvedCase(
        TestUnitDescriptor descriptor,
        Class<?> type,
        TestMethodDefinition definition,
        BoundLifecycle lifecycle,
        Verdict terminal) {

    static ResolvedCase runnable(
            TestUnitDescriptor descriptor,
            Class<?> type,
            TestMethodDefinition definition,
            BoundLifecycle lifecycle) {
        return new ResolvedCase(descriptor, type, definition, lifecycle, null);
    }

    static ResolvedCase terminal(
            TestUnitDescriptor descriptor,
            Class<?> type,
            TestMethodDefinition definition,
            Verdict terminal) {
        return new ResolvedCase(descriptor, type, definition, null, terminal);
    }

    public boolean isRunnable() {
        return terminal == null;
    }

    public Optional<TestMethodDefinition> getDefinition() {
        return Optional.ofNullable(definition);
    }
}
