package io.assay.core.execution;

import io.assay.core.AssayConfig;
import io.assay.core.descriptor.DataSourceProvider;
import io.assay.core.descriptor.MetadataResolver;
import io.assay.core.lifecycle.LifecycleRegistry;
import io.assay.core.output.CapturedOutput;
import io.assay.core.output.OutputMultiplexer;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/// Run-scoped services shared by the pipeline, the data expansion and the scheduler.
///
/// One session exists per run. It carries the run's configuration explicitly and owns
/// nothing that outlives the run; the boundary executor belongs to the environment.
///
/// ### Contracts
/// - **Invariant**: Component references are immutable after construction
///
/// @implNote Safe for concurrent reads. The registry and multiplexer are internally
/// synchronized; everything else is immutable.
public final class ExecutionSession {

    private final AssayConfig config;
    private final MetadataResolver resolver;
    private final DataSourceProvider dataSourceProvider;
    private final LifecycleRegistry registry;
    private final OutputMultiplexer multiplexer;
    private final CancellationHandle runCancellation;
    private final TimeoutBoundary boundary;
    private final LifecycleInvoker invoker;
    private final ExceptionClassifier classifier;

    private ExecutionSession(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.resolver = Objects.requireNonNull(builder.resolver, "resolver");
        this.dataSourceProvider = builder.dataSourceProvider;
        this.registry = new LifecycleRegistry(resolver);
        this.multiplexer = builder.multiplexer;
        this.runCancellation = builder.runCancellation;
        this.boundary =
                new TimeoutBoundary(
                        Objects.requireNonNull(builder.boundaryExecutor, "boundaryExecutor"),
                        builder.forcedAbort,
                        config.getAbortGracePeriod(),
                        multiplexer);
        this.invoker = new LifecycleInvoker(boundary);
        this.classifier = new ExceptionClassifier(builder.verifier);
    }

    public AssayConfig getConfig() {
        return config;
    }

    public MetadataResolver getResolver() {
        return resolver;
    }

    public DataSourceProvider getDataSourceProvider() {
        return dataSourceProvider;
    }

    public LifecycleRegistry getRegistry() {
        return registry;
    }

    public OutputMultiplexer getMultiplexer() {
        return multiplexer;
    }

    /// Returns the run-wide cancellation handle; case handles are children of it.
    ///
    /// @return run cancellation handle, never null
    public CancellationHandle getRunCancellation() {
        return runCancellation;
    }

    public TimeoutBoundary getBoundary() {
        return boundary;
    }

    public LifecycleInvoker getInvoker() {
        return invoker;
    }

    public ExceptionClassifier getClassifier() {
        return classifier;
    }

    /// Closes the output scope of `context`, keeping the diagnostic trace only when the
    /// run captures it.
    CapturedOutput closeOutput(CaseExecutionContext context) {
        CapturedOutput output = context.closeOutput();
        return config.isCaptureTrace() ? output : output.withoutTrace();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link ExecutionSession}.
    public static final class Builder {
        private AssayConfig config = AssayConfig.defaults();
        private MetadataResolver resolver;
        private DataSourceProvider dataSourceProvider = DataSourceProvider.NONE;
        private OutputMultiplexer multiplexer = new OutputMultiplexer();
        private CancellationHandle runCancellation = CancellationHandle.create();
        private ExecutorService boundaryExecutor;
        private ForcedAbort forcedAbort = ForcedAbort.INTERRUPT;
        private ExpectedFailureVerifier verifier = new DefaultExpectedFailureVerifier();

        private Builder() {}

        public Builder config(AssayConfig config) {
            this.config = config;
            return this;
        }

        public Builder resolver(MetadataResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder dataSourceProvider(DataSourceProvider dataSourceProvider) {
            this.dataSourceProvider = dataSourceProvider;
            return this;
        }

        public Builder multiplexer(OutputMultiplexer multiplexer) {
            this.multiplexer = multiplexer;
            return this;
        }

        public Builder runCancellation(CancellationHandle runCancellation) {
            this.runCancellation = runCancellation;
            return this;
        }

        public Builder boundaryExecutor(ExecutorService boundaryExecutor) {
            this.boundaryExecutor = boundaryExecutor;
            return this;
        }

        public Builder forcedAbort(ForcedAbort forcedAbort) {
            this.forcedAbort = forcedAbort;
            return this;
        }

        public Builder verifier(ExpectedFailureVerifier verifier) {
            this.verifier = verifier;
            return this;
        }

        public ExecutionSession build() {
            return new ExecutionSession(this);
        }
    }
}
