package io.assay.core.descriptor;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Lifecycle bindings a single class declares itself.
///
/// Inherited bindings are not part of this object; the lifecycle registry assembles
/// them by walking the class ancestry and asking for each ancestor's own bindings.
///
/// @implNote The builder accepts several bindings for the same role so that the
/// registry can report the duplicate as an inspection failure instead of silently
/// keeping one.
public final class ClassBindings {

    /// Bindings of a class that declares no lifecycle methods.
    public static final ClassBindings NONE = new ClassBindings(List.of(), null, null);

    private final List<LifecycleBinding> bindings;
    private final ContextSlot contextSlot;
    private final String ignoreReason;

    private ClassBindings(
            List<LifecycleBinding> bindings, ContextSlot contextSlot, String ignoreReason) {
        this.bindings = List.copyOf(bindings);
        this.contextSlot = contextSlot;
        this.ignoreReason = ignoreReason;
    }

    public List<LifecycleBinding> getBindings() {
        return bindings;
    }

    /// Returns the bindings declared for `role`, in declaration order.
    ///
    /// @param role lifecycle role, not null
    /// @return matching bindings, never null
    public List<LifecycleBinding> bindingsFor(LifecycleRole role) {
        return bindings.stream().filter(b -> b.role() == role).toList();
    }

    public Optional<ContextSlot> getContextSlot() {
        return Optional.ofNullable(contextSlot);
    }

    /// Returns the reason every test of this class is skipped.
    ///
    /// @return ignore reason, or empty when the class runs normally
    public Optional<String> getIgnoreReason() {
        return Optional.ofNullable(ignoreReason);
    }

    /// Starts bindings for `type`; method names passed to the builder are looked up on it.
    ///
    /// @param type the declaring class, not null
    /// @return new builder, never null
    public static Builder builder(Class<?> type) {
        return new Builder(type);
    }

    /// Builder for {@link ClassBindings}.
    public static final class Builder {
        private final Class<?> type;
        private final List<LifecycleBinding> bindings = new ArrayList<>();
        private ContextSlot contextSlot;
        private String ignoreReason;

        private Builder(Class<?> type) {
            this.type = type;
        }

        public Builder bind(LifecycleRole role, Method method, Duration timeout) {
            bindings.add(new LifecycleBinding(role, method, timeout));
            return this;
        }

        public Builder bind(LifecycleRole role, String methodName) {
            return bind(role, MethodLookup.declared(type, methodName), null);
        }

        public Builder classInitialize(String methodName) {
            return bind(LifecycleRole.CLASS_INITIALIZE, methodName);
        }

        public Builder classCleanup(String methodName) {
            return bind(LifecycleRole.CLASS_CLEANUP, methodName);
        }

        public Builder caseInitialize(String methodName) {
            return bind(LifecycleRole.CASE_INITIALIZE, methodName);
        }

        public Builder caseCleanup(String methodName) {
            return bind(LifecycleRole.CASE_CLEANUP, methodName);
        }

        /// Declares a writable context slot set through `setterName`.
        ///
        /// @param name property name, not null
        /// @param setterName name of the instance method receiving the context, not null
        /// @return this builder for chaining, never null
        public Builder contextSlot(String name, String setterName) {
            this.contextSlot = new ContextSlot(name, MethodLookup.declared(type, setterName));
            return this;
        }

        /// Declares a context slot that cannot be assigned.
        ///
        /// @param name property name, not null
        /// @return this builder for chaining, never null
        public Builder readOnlyContextSlot(String name) {
            this.contextSlot = new ContextSlot(name, null);
            return this;
        }

        public Builder ignore(String reason) {
            this.ignoreReason = reason;
            return this;
        }

        public ClassBindings build() {
            return new ClassBindings(bindings, contextSlot, ignoreReason);
        }
    }
}
