package io.assay.core.lifecycle;

import io.assay.core.descriptor.LifecycleBinding;
import io.assay.core.result.FailureKind;
import java.util.List;

/// Lifecycle state of one loaded module within a run.
///
/// One instance per module per run. Its initialize chain completes, successfully or
/// with a cached failure, before any class of the module starts initializing.
public final class ModuleLifecycleState extends ScopeLifecycle {

    private final String moduleName;

    ModuleLifecycleState(
            String moduleName,
            List<LifecycleBinding> initializeChain,
            List<LifecycleBinding> cleanupChain,
            LifecycleInspectionException inspectionFailure) {
        super(initializeChain, cleanupChain, inspectionFailure);
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }

    @Override
    protected FailureKind initializeFailureKind() {
        return FailureKind.MODULE_INITIALIZE_FAILURE;
    }

    @Override
    protected String describe() {
        return "Module " + moduleName;
    }

    @Override
    public String toString() {
        return "ModuleLifecycleState{" + moduleName + ", status=" + getStatus() + '}';
    }
}
