package io.assay.core.execution;

import io.assay.core.lifecycle.LifecycleInspectionException;
import io.assay.core.lifecycle.ModuleLifecycleState;
import io.assay.core.result.FailureKind;
import java.util.Optional;

/// Runs the module initialize chain on the first case of a module and reapplies its
/// cached failure to every later case.
final class ModuleInitializeProcessor implements CaseProcessor {

    @Override
    public Optional<Verdict> process(CaseInvocation invocation) {
        ModuleLifecycleState module = invocation.getLifecycle().module();
        Optional<LifecycleInspectionException> inspection = module.getInspectionFailure();
        if (inspection.isPresent()) {
            return Optional.of(
                    Verdict.failed(FailureKind.INSPECTION_FAILURE, inspection.get().getMessage()));
        }
        LifecycleInvoker invoker = invocation.getSession().getInvoker();
        CaseExecutionContext context = invocation.getContext();
        return module.initializeOnce(chain -> invoker.initialize(chain, context))
                .map(Verdict::of);
    }
}
