package io.assay.core;

import io.assay.core.descriptor.DataSourceProvider;
import io.assay.core.descriptor.MetadataResolver;
import io.assay.core.execution.DefaultExpectedFailureVerifier;
import io.assay.core.execution.ExpectedFailureVerifier;
import io.assay.core.execution.ForcedAbort;
import io.assay.core.scheduler.NamedThreadFactory;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Factory for creating and wiring Assay environments.
///
/// ### Usage Patterns
///
/// **Quick start** with an in-memory binding table:
/// {@snippet :
/// try (var env = AssayFactory.createEnvironment(table)) {
///     RunSummary summary = env.getEngine()
///         .execute(table.descriptors(), AssayConfig.defaults(), sink);
/// }
/// }
///
/// **Builder** for custom data sources or abort strategies:
/// {@snippet :
/// var env = AssayFactory.builder()
///     .resolver(table)
///     .dataSourceProvider(csvRows)
///     .forcedAbort(ForcedAbort.UNSUPPORTED)
///     .build();
/// }
///
/// @see AssayEnvironment
/// @see AssayConfig
public final class AssayFactory {

    private AssayFactory() {}

    /// Creates an environment for `resolver` with default collaborators.
    ///
    /// @param resolver source of classes, methods and lifecycle bindings, not null
    /// @return a fully-configured environment, never null
    public static AssayEnvironment createEnvironment(MetadataResolver resolver) {
        return builder().resolver(resolver).build();
    }

    /// Creates an environment for `resolver` reading external rows from `provider`.
    ///
    /// @param resolver source of classes, methods and lifecycle bindings, not null
    /// @param provider rows for named data sources, not null
    /// @return a fully-configured environment, never null
    public static AssayEnvironment createEnvironment(
            MetadataResolver resolver, DataSourceProvider provider) {
        return builder().resolver(resolver).dataSourceProvider(provider).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Creates the default boundary pool: unbounded, so a timed case never waits for a
    /// thread, with daemon threads, so abandoned work cannot keep the JVM alive.
    ///
    /// @return new executor, never null
    static ExecutorService createBoundaryExecutor() {
        return Executors.newCachedThreadPool(new NamedThreadFactory("assay-boundary", true));
    }

    /// Fluent builder for {@link AssayEnvironment}.
    public static final class Builder {
        private MetadataResolver resolver;
        private DataSourceProvider dataSourceProvider = DataSourceProvider.NONE;
        private ExecutorService boundaryExecutor;
        private ForcedAbort forcedAbort = ForcedAbort.INTERRUPT;
        private ExpectedFailureVerifier verifier = new DefaultExpectedFailureVerifier();

        private Builder() {}

        public Builder resolver(MetadataResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder dataSourceProvider(DataSourceProvider dataSourceProvider) {
            this.dataSourceProvider = dataSourceProvider;
            return this;
        }

        /// Sets the pool running timed work. The environment shuts it down on close.
        ///
        /// @param boundaryExecutor pool to use, not null
        /// @return this builder
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

        /// Builds the environment.
        ///
        /// @return new environment, never null
        /// @throws NullPointerException if no resolver was set
        public AssayEnvironment build() {
            Objects.requireNonNull(resolver, "resolver");
            ExecutorService executor =
                    boundaryExecutor != null ? boundaryExecutor : createBoundaryExecutor();
            AssayEngine engine =
                    new AssayEngine(resolver, dataSourceProvider, executor, forcedAbort, verifier);
            return new AssayEnvironment(engine, executor);
        }
    }
}
