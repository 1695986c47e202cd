package io.assay.core;

import io.assay.core.scheduler.ParallelScope;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Configuration of one engine run.
///
/// Built once per run and passed explicitly to the engine; nothing in the engine
/// reads run settings from ambient state.
///
/// ### Default Values
/// - `parallelizationDisabled`: `false`
/// - `workers`: `0`, one worker per available processor
/// - `parallelScope`: {@link ParallelScope#CLASS}
/// - `defaultTimeout`: {@link Duration#ZERO}, no timeout
/// - `treatCleanupWarningsAsErrors`: `false`
/// - `captureTrace`: `true`
/// - `considerEmptyDataSourceAsInconclusive`: `false`
/// - `classCleanupBehavior`: {@link ClassCleanupBehavior#END_OF_MODULE}
/// - `abortGracePeriod`: 2 seconds
/// - `runParameters`: empty
///
/// @implNote Immutable once built; safe to share between threads.
///
/// @see Builder
public final class AssayConfig {

    private final boolean parallelizationDisabled;
    private final int workers;
    private final ParallelScope parallelScope;
    private final Duration defaultTimeout;
    private final boolean treatCleanupWarningsAsErrors;
    private final boolean captureTrace;
    private final boolean considerEmptyDataSourceAsInconclusive;
    private final ClassCleanupBehavior classCleanupBehavior;
    private final Duration abortGracePeriod;
    private final Map<String, Object> runParameters;

    private AssayConfig(Builder builder) {
        this.parallelizationDisabled = builder.parallelizationDisabled;
        this.workers = builder.workers;
        this.parallelScope = builder.parallelScope;
        this.defaultTimeout = builder.defaultTimeout;
        this.treatCleanupWarningsAsErrors = builder.treatCleanupWarningsAsErrors;
        this.captureTrace = builder.captureTrace;
        this.considerEmptyDataSourceAsInconclusive = builder.considerEmptyDataSourceAsInconclusive;
        this.classCleanupBehavior = builder.classCleanupBehavior;
        this.abortGracePeriod = builder.abortGracePeriod;
        this.runParameters =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.runParameters));
    }

    /// Returns a configuration with every default applied.
    ///
    /// @return default configuration, never null
    public static AssayConfig defaults() {
        return builder().build();
    }

    /// Returns whether every case runs serially regardless of workers and scope.
    ///
    /// @return true when parallel execution is switched off
    public boolean isParallelizationDisabled() {
        return parallelizationDisabled;
    }

    /// Returns the configured worker count.
    ///
    /// @return worker count, `0` meaning one per available processor
    public int getWorkers() {
        return workers;
    }

    /// Returns the number of workers a run actually uses.
    ///
    /// @return `1` when parallelization is disabled, otherwise the configured or
    /// automatic worker count, always positive
    public int effectiveWorkers() {
        if (parallelizationDisabled) {
            return 1;
        }
        return workers > 0 ? workers : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public ParallelScope getParallelScope() {
        return parallelScope;
    }

    /// Returns the timeout applied to cases that declare none.
    ///
    /// @return default timeout, {@link Duration#ZERO} for none
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public boolean isTreatCleanupWarningsAsErrors() {
        return treatCleanupWarningsAsErrors;
    }

    /// Whether results keep the diagnostic trace their cases wrote.
    ///
    /// @return true when the trace is captured
    public boolean isCaptureTrace() {
        return captureTrace;
    }

    public boolean isConsiderEmptyDataSourceAsInconclusive() {
        return considerEmptyDataSourceAsInconclusive;
    }

    public ClassCleanupBehavior getClassCleanupBehavior() {
        return classCleanupBehavior;
    }

    /// Returns how long a timed-out case may take to exit after it was aborted.
    ///
    /// @return grace period, never null
    public Duration getAbortGracePeriod() {
        return abortGracePeriod;
    }

    /// Returns the parameters copied into every case context of the run.
    ///
    /// @return unmodifiable parameters in insertion order, never null
    public Map<String, Object> getRunParameters() {
        return runParameters;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link AssayConfig}.
    public static final class Builder {
        private boolean parallelizationDisabled;
        private int workers;
        private ParallelScope parallelScope = ParallelScope.CLASS;
        private Duration defaultTimeout = Duration.ZERO;
        private boolean treatCleanupWarningsAsErrors;
        private boolean captureTrace = true;
        private boolean considerEmptyDataSourceAsInconclusive;
        private ClassCleanupBehavior classCleanupBehavior = ClassCleanupBehavior.END_OF_MODULE;
        private Duration abortGracePeriod = Duration.ofSeconds(2);
        private final Map<String, Object> runParameters = new LinkedHashMap<>();

        private Builder() {}

        /// Switches parallel execution off; workers and scope are then ignored.
        ///
        /// @param parallelizationDisabled `true` to run every case serially
        /// @return this builder for chaining, never null
        public Builder parallelizationDisabled(boolean parallelizationDisabled) {
            this.parallelizationDisabled = parallelizationDisabled;
            return this;
        }

        /// Sets the worker count.
        ///
        /// @param workers number of workers, `0` for one per available processor
        /// @return this builder for chaining, never null
        /// @throws IllegalArgumentException if `workers` is negative
        public Builder workers(int workers) {
            if (workers < 0) {
                throw new IllegalArgumentException("workers must not be negative: " + workers);
            }
            this.workers = workers;
            return this;
        }

        public Builder parallelScope(ParallelScope parallelScope) {
            this.parallelScope = parallelScope;
            return this;
        }

        /// Sets the timeout for cases that declare none.
        ///
        /// @param defaultTimeout timeout, {@link Duration#ZERO} for none, not null
        /// @return this builder for chaining, never null
        public Builder defaultTimeout(Duration defaultTimeout) {
            if (defaultTimeout.isNegative()) {
                throw new IllegalArgumentException("defaultTimeout must not be negative");
            }
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder treatCleanupWarningsAsErrors(boolean treatCleanupWarningsAsErrors) {
            this.treatCleanupWarningsAsErrors = treatCleanupWarningsAsErrors;
            return this;
        }

        public Builder captureTrace(boolean captureTrace) {
            this.captureTrace = captureTrace;
            return this;
        }

        public Builder considerEmptyDataSourceAsInconclusive(boolean value) {
            this.considerEmptyDataSourceAsInconclusive = value;
            return this;
        }

        public Builder classCleanupBehavior(ClassCleanupBehavior classCleanupBehavior) {
            this.classCleanupBehavior = classCleanupBehavior;
            return this;
        }

        public Builder abortGracePeriod(Duration abortGracePeriod) {
            this.abortGracePeriod = abortGracePeriod;
            return this;
        }

        public Builder runParameter(String name, Object value) {
            this.runParameters.put(name, value);
            return this;
        }

        public Builder runParameters(Map<String, ?> runParameters) {
            this.runParameters.putAll(runParameters);
            return this;
        }

        /// Builds the configuration.
        ///
        /// @return the configured instance, never null
        public AssayConfig build() {
            return new AssayConfig(this);
        }
    }
}
