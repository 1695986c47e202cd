package io.assay.core.execution;

import io.assay.core.lifecycle.ClassLifecycleState;
import io.assay.core.lifecycle.LifecycleInspectionException;
import io.assay.core.result.FailureKind;
import java.util.Optional;

/// Runs the inherited class initialize chain once per class, oldest ancestor first.
final class ClassInitializeProcessor implements CaseProcessor {

    @Override
    public Optional<Verdict> process(CaseInvocation invocation) {
        ClassLifecycleState state = invocation.getLifecycle().type();
        Optional<LifecycleInspectionException> inspection = state.getInspectionFailure();
        if (inspection.isPresent()) {
            return Optional.of(
                    Verdict.failed(FailureKind.INSPECTION_FAILURE, inspection.get().getMessage()));
        }
        LifecycleInvoker invoker = invocation.getSession().getInvoker();
        CaseExecutionContext context = invocation.getContext();
        return state.initializeOnce(chain -> invoker.initialize(chain, context)).map(Verdict::of);
    }
}
