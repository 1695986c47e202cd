package io.assay.core;

import io.assay.core.descriptor.DataSourceProvider;
import io.assay.core.descriptor.MetadataResolver;
import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.execution.ExecutionSession;
import io.assay.core.execution.ExpectedFailureVerifier;
import io.assay.core.execution.ForcedAbort;
import io.assay.core.output.OutputMultiplexer;
import io.assay.core.result.ResultSink;
import io.assay.core.result.RunSummary;
import io.assay.core.scheduler.RunCancellation;
import io.assay.core.scheduler.Scheduler;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Entry point for running test descriptors.
///
/// Every call to {@link #execute} starts a fresh run: a new session with its own
/// lifecycle registry, output multiplexer and run parameters, so nothing leaks from one
/// run into the next.
///
/// ### Contracts
/// - **Precondition**: descriptors were produced by the engine's metadata resolver
/// - **Postcondition**: the sink received one result per expanded case, then the summary
///
/// @implNote Thread-safe. Concurrent runs share only the boundary executor.
///
/// @see AssayFactory
public final class AssayEngine {

    private static final Logger logger = Logger.getLogger(AssayEngine.class.getName());

    private final MetadataResolver resolver;
    private final DataSourceProvider dataSourceProvider;
    private final ExecutorService boundaryExecutor;
    private final ForcedAbort forcedAbort;
    private final ExpectedFailureVerifier verifier;

    /// Creates an engine.
    ///
    /// @param resolver source of classes, methods and lifecycle bindings, not null
    /// @param dataSourceProvider rows for named data sources, not null
    /// @param boundaryExecutor pool running timed work, not null; owned by the caller
    /// @param forcedAbort fallback for timed-out work ignoring cancellation, not null
    /// @param verifier expected failure matcher, not null
    public AssayEngine(
            MetadataResolver resolver,
            DataSourceProvider dataSourceProvider,
            ExecutorService boundaryExecutor,
            ForcedAbort forcedAbort,
            ExpectedFailureVerifier verifier) {
        this.resolver = resolver;
        this.dataSourceProvider = dataSourceProvider;
        this.boundaryExecutor = boundaryExecutor;
        this.forcedAbort = forcedAbort;
        this.verifier = verifier;
    }

    /// Runs `descriptors` to completion.
    ///
    /// @param descriptors descriptors in submission order, not null
    /// @param config run configuration, not null
    /// @param sink receiver of results and the run summary, not null
    /// @return summary of the run, never null
    public RunSummary execute(
            List<TestUnitDescriptor> descriptors, AssayConfig config, ResultSink sink) {
        return execute(descriptors, config, sink, new RunCancellation());
    }

    /// Runs `descriptors` until done or cancelled through `cancellation`.
    ///
    /// @param descriptors descriptors in submission order, not null
    /// @param config run configuration, not null
    /// @param sink receiver of results and the run summary, not null
    /// @param cancellation handle the caller may cancel the run through, not null
    /// @return summary of the run, never null
    public RunSummary execute(
            List<TestUnitDescriptor> descriptors,
            AssayConfig config,
            ResultSink sink,
            RunCancellation cancellation) {
        logger.info(
                "Starting run of "
                        + descriptors.size()
                        + " test(s) with "
                        + config.getRunParameters().size()
                        + " run parameter(s)");
        ExecutionSession session =
                ExecutionSession.builder()
                        .config(config)
                        .resolver(resolver)
                        .dataSourceProvider(dataSourceProvider)
                        .multiplexer(new OutputMultiplexer())
                        .runCancellation(cancellation.getHandle())
                        .boundaryExecutor(boundaryExecutor)
                        .forcedAbort(forcedAbort)
                        .verifier(verifier)
                        .build();
        return new Scheduler(session).run(List.copyOf(descriptors), sink);
    }

    public MetadataResolver getResolver() {
        return resolver;
    }
}
