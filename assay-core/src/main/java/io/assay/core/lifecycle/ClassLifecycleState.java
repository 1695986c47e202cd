package io.assay.core.lifecycle;

import io.assay.core.descriptor.ContextSlot;
import io.assay.core.descriptor.LifecycleBinding;
import io.assay.core.result.FailureKind;
import java.util.List;
import java.util.Optional;

/// Lifecycle state of one concrete test class within a run.
///
/// Holds the flattened chains assembled from the class ancestry:
///
/// - class initialize, oldest ancestor first
/// - class cleanup, the class itself first
/// - case initialize, oldest ancestor first
/// - case cleanup, the class itself first
///
/// The class-scope chains run once per run through {@link #initializeOnce}; the case
/// chains are replayed for every case by the invocation pipeline.
public final class ClassLifecycleState extends ScopeLifecycle {

    private final Class<?> type;
    private final String moduleName;
    private final List<LifecycleBinding> caseInitializeChain;
    private final List<LifecycleBinding> caseCleanupChain;
    private final ContextSlot contextSlot;
    private final String ignoreReason;

    ClassLifecycleState(
            Class<?> type,
            String moduleName,
            List<LifecycleBinding> classInitializeChain,
            List<LifecycleBinding> classCleanupChain,
            List<LifecycleBinding> caseInitializeChain,
            List<LifecycleBinding> caseCleanupChain,
            ContextSlot contextSlot,
            String ignoreReason,
            LifecycleInspectionException inspectionFailure) {
        super(classInitializeChain, classCleanupChain, inspectionFailure);
        this.type = type;
        this.moduleName = moduleName;
        this.caseInitializeChain = List.copyOf(caseInitializeChain);
        this.caseCleanupChain = List.copyOf(caseCleanupChain);
        this.contextSlot = contextSlot;
        this.ignoreReason = ignoreReason;
    }

    public Class<?> getType() {
        return type;
    }

    public String getModuleName() {
        return moduleName;
    }

    public List<LifecycleBinding> getCaseInitializeChain() {
        return caseInitializeChain;
    }

    public List<LifecycleBinding> getCaseCleanupChain() {
        return caseCleanupChain;
    }

    /// Returns the context slot nearest to the concrete class in its ancestry.
    ///
    /// @return context slot, or empty when no class in the ancestry declares one
    public Optional<ContextSlot> getContextSlot() {
        return Optional.ofNullable(contextSlot);
    }

    public Optional<String> getIgnoreReason() {
        return Optional.ofNullable(ignoreReason);
    }

    @Override
    protected FailureKind initializeFailureKind() {
        return FailureKind.CLASS_INITIALIZE_FAILURE;
    }

    @Override
    protected String describe() {
        return "Class " + type.getName();
    }

    @Override
    public String toString() {
        return "ClassLifecycleState{" + type.getName() + ", status=" + getStatus() + '}';
    }
}
