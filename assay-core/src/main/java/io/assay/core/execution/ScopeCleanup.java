package io.assay.core.execution;

import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.lifecycle.ScopeLifecycle;
import io.assay.core.output.CapturedOutput;
import java.util.List;
import java.util.logging.Logger;

/// Runs the cleanup chain of a module or class scope.
///
/// Each scope is cleaned at most once per run, and only when its initialize chain was
/// attempted. The chain runs under a context of the scope's last case so that output
/// and warnings can be attached to that case's result.
public final class ScopeCleanup {

    private static final Logger logger = Logger.getLogger(ScopeCleanup.class.getName());

    private final ExecutionSession session;

    public ScopeCleanup(ExecutionSession session) {
        this.session = session;
    }

    /// Runs the cleanup chain of `scope` if this call claims it.
    ///
    /// @param scope module or class state, not null
    /// @param lastCase descriptor of the scope's last case, not null
    /// @return warnings and output of the chain, {@link Report#NONE} when not claimed
    public Report cleanup(ScopeLifecycle scope, TestUnitDescriptor lastCase) {
        if (!scope.claimCleanup()) {
            return Report.NONE;
        }
        CaseExecutionContext context =
                CaseExecutionContext.builder(lastCase, session.getMultiplexer())
                        .runParameters(session.getConfig().getRunParameters())
                        .build();
        List<String> warnings =
                session.getInvoker().cleanup(scope.getCleanupChain(), null, context);
        CapturedOutput output = session.closeOutput(context);
        for (String warning : warnings) {
            logger.warning(warning);
        }
        return new Report(warnings, output);
    }

    /// Outcome of one scope cleanup.
    ///
    /// @param warnings one entry per failing binding, not null
    /// @param output text written by the cleanup chain, not null
    public record Report(List<String> warnings, CapturedOutput output) {

        public static final Report NONE = new Report(List.of(), CapturedOutput.EMPTY);

        public Report {
            warnings = List.copyOf(warnings);
        }

        public boolean isEmpty() {
            return warnings.isEmpty() && output.isEmpty();
        }
    }
}
