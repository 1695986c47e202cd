package io.assay.core.execution;

import io.assay.core.descriptor.TestMethodDefinition;
import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.lifecycle.BoundLifecycle;

/// Mutable state of one case while it moves through the pipeline.
///
/// Confined to the worker running the case; the only field written after
/// construction is the test instance.
public final class CaseInvocation {

    private final ExecutionSession session;
    private final TestUnitDescriptor descriptor;
    private final TestMethodDefinition definition;
    private final Class<?> type;
    private final BoundLifecycle lifecycle;
    private final CaseExecutionContext context;
    private final Object[] arguments;
    private Object instance;

    CaseInvocation(
            ExecutionSession session,
            TestUnitDescriptor descriptor,
            TestMethodDefinition definition,
            Class<?> type,
            BoundLifecycle lifecycle,
            CaseExecutionContext context,
            Object[] arguments) {
        this.session = session;
        this.descriptor = descriptor;
        this.definition = definition;
        this.type = type;
        this.lifecycle = lifecycle;
        this.context = context;
        this.arguments = arguments;
    }

    public ExecutionSession getSession() {
        return session;
    }

    public TestUnitDescriptor getDescriptor() {
        return descriptor;
    }

    public TestMethodDefinition getDefinition() {
        return definition;
    }

    public Class<?> getType() {
        return type;
    }

    public BoundLifecycle getLifecycle() {
        return lifecycle;
    }

    public CaseExecutionContext getContext() {
        return context;
    }

    public Object[] getArguments() {
        return arguments;
    }

    /// Returns the test instance.
    ///
    /// @return instance, or null before construction or when construction failed
    public Object getInstance() {
        return instance;
    }

    void setInstance(Object instance) {
        this.instance = instance;
    }
}
