package io.assay.core.descriptor;

import java.util.ArrayList;
import java.util.List;

/// Module initialize and cleanup bindings of one loaded module.
public final class ModuleBindings {

    public static final ModuleBindings NONE = new ModuleBindings(List.of());

    private final List<LifecycleBinding> bindings;

    private ModuleBindings(List<LifecycleBinding> bindings) {
        this.bindings = List.copyOf(bindings);
    }

    public List<LifecycleBinding> getBindings() {
        return bindings;
    }

    public List<LifecycleBinding> bindingsFor(LifecycleRole role) {
        return bindings.stream().filter(b -> b.role() == role).toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link ModuleBindings}; methods are looked up on the class passed in.
    public static final class Builder {
        private final List<LifecycleBinding> bindings = new ArrayList<>();

        private Builder() {}

        public Builder initialize(Class<?> type, String methodName) {
            bindings.add(
                    new LifecycleBinding(
                            LifecycleRole.MODULE_INITIALIZE,
                            MethodLookup.declared(type, methodName)));
            return this;
        }

        public Builder cleanup(Class<?> type, String methodName) {
            bindings.add(
                    new LifecycleBinding(
                            LifecycleRole.MODULE_CLEANUP, MethodLookup.declared(type, methodName)));
            return this;
        }

        public ModuleBindings build() {
            return new ModuleBindings(bindings);
        }
    }
}
