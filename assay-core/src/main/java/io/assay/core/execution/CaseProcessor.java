package io.assay.core.execution;

import java.util.Optional;

/// One setup step a case passes through before its body runs.
///
/// ### Contracts
/// - **Precondition**: every earlier processor returned empty
/// - **Postcondition**: returns a terminal verdict to stop the case, or empty to continue
/// - Exceptions raised by test code are converted to verdicts, never thrown
///
/// @see CaseProcessorPipeline
@FunctionalInterface
public interface CaseProcessor {

    /// Runs this step.
    ///
    /// @param invocation the case being set up, not null
    /// @return terminal verdict, or empty to proceed
    Optional<Verdict> process(CaseInvocation invocation);
}
