package io.assay.core.execution;

import java.util.List;
import java.util.Optional;

/// Executes a list of {@link CaseProcessor}s in order, short-circuiting on the first
/// terminal verdict.
///
/// ### Contracts
/// - **Precondition**: `processors` list is non-null (may be empty)
/// - **Postcondition**: Returns the first terminal verdict, or empty if all processors pass
/// - **Invariant**: Processors are invoked in list order; none is skipped unless a prior
///   one short-circuits
///
/// @implNote Stateless and thread-safe. The processor list is copied at construction.
public final class CaseProcessorPipeline {

    private final List<CaseProcessor> processors;

    public CaseProcessorPipeline(List<CaseProcessor> processors) {
        this.processors = List.copyOf(processors);
    }

    /// Builds the setup pipeline every case passes through.
    ///
    /// Pipeline order:
    /// 1. Module initialize, exactly once per module
    /// 2. Class initialize, exactly once per class, oldest ancestor first
    /// 3. Instance construction
    /// 4. Context injection through the class's context slot
    ///
    /// @return configured setup pipeline, never null
    public static CaseProcessorPipeline setup() {
        return new CaseProcessorPipeline(
                List.of(
                        new ModuleInitializeProcessor(),
                        new ClassInitializeProcessor(),
                        new InstanceConstructionProcessor(),
                        new ContextInjectionProcessor()));
    }

    /// Runs the processors in order.
    ///
    /// @param invocation the case being set up, not null
    /// @return terminal verdict if a processor short-circuits, empty if all pass
    public Optional<Verdict> execute(CaseInvocation invocation) {
        for (var processor : processors) {
            var verdict = processor.process(invocation);
            if (verdict.isPresent()) {
                return verdict;
            }
        }
        return Optional.empty();
    }
}
