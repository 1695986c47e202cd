package io.assay.core.execution;

import io.assay.core.descriptor.ContextSlot;
import io.assay.core.result.FailureDetail;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import io.assay.core.result.StackTraces;
import java.util.Optional;

/// Hands the case context to the instance through the class's context slot.
///
/// A missing slot or a read-only one is not an error.
final class ContextInjectionProcessor implements CaseProcessor {

    @Override
    public Optional<Verdict> process(CaseInvocation invocation) {
        Optional<ContextSlot> slot = invocation.getLifecycle().type().getContextSlot();
        if (slot.isEmpty() || !slot.get().isWritable()) {
            return Optional.empty();
        }
        try {
            invocation
                    .getSession()
                    .getInvoker()
                    .invokeMethod(
                            slot.get().setter(),
                            invocation.getInstance(),
                            new Object[] {invocation.getContext()});
            return Optional.empty();
        } catch (Throwable t) {
            Throwable error = StackTraces.unwrap(t);
            String className = invocation.getType().getName();
            return Optional.of(
                    new Verdict(
                            Outcome.FAILED,
                            FailureDetail.of(
                                    FailureKind.CONTEXT_BINDING_FAILURE,
                                    "Unable to set context property '"
                                            + slot.get().name()
                                            + "' for the class "
                                            + className
                                            + ". Error: "
                                            + StackTraces.formatMessage(error)
                                            + ".",
                                    error,
                                    className)));
        }
    }
}
