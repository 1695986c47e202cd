package io.assay.core.result;

import io.assay.core.descriptor.TestUnitDescriptor;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/// Immutable outcome of one executed case.
///
/// One result is produced per expansion of a descriptor: a plain test yields a single
/// result, a data-driven test yields one per row with {@link #getRowIndex()} set.
///
/// ### Contracts
/// - `outcome` and `descriptor` are never null
/// - `failure` is null for {@link Outcome#PASSED} results unless an expected failure was
///   verified, in which case it is still null
/// - `warnings` hold secondary diagnostics (cleanup failures); they never replace `failure`
///
/// @implNote Instances are created through {@link Builder}. Adding warnings after the
/// fact goes through {@link #withWarnings(List)}, which returns a copy.
///
/// @see Outcome
/// @see OutcomeRecord for the canonical form handed to result sinks
public final class CaseResult {

    private final TestUnitDescriptor descriptor;
    private final Outcome outcome;
    private final FailureDetail failure;
    private final List<String> warnings;
    private final Duration duration;
    private final Instant startTime;
    private final Instant endTime;
    private final String standardOutput;
    private final String diagnosticTrace;
    private final List<Path> resultFiles;
    private final Integer rowIndex;
    private final String displayName;

    private CaseResult(Builder builder) {
        this.descriptor = builder.descriptor;
        this.outcome = builder.outcome;
        this.failure = builder.failure;
        this.warnings = List.copyOf(builder.warnings);
        this.duration = builder.duration;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.standardOutput = builder.standardOutput;
        this.diagnosticTrace = builder.diagnosticTrace;
        this.resultFiles = List.copyOf(builder.resultFiles);
        this.rowIndex = builder.rowIndex;
        this.displayName = builder.displayName;
    }

    public TestUnitDescriptor getDescriptor() {
        return descriptor;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /// Returns the failure that produced a non-passing outcome.
    ///
    /// @return failure detail, or null when the case passed or was ignored without reason
    public FailureDetail getFailure() {
        return failure;
    }

    /// Returns secondary diagnostics such as cleanup failures.
    ///
    /// @return unmodifiable warning list, never null
    public List<String> getWarnings() {
        return warnings;
    }

    public Duration getDuration() {
        return duration;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    /// Returns text captured on the standard output channel while the case ran.
    ///
    /// @return captured output, never null (may be empty)
    public String getStandardOutput() {
        return standardOutput;
    }

    /// Returns text captured on the diagnostic trace channel while the case ran.
    ///
    /// @return captured trace, never null (may be empty)
    public String getDiagnosticTrace() {
        return diagnosticTrace;
    }

    public List<Path> getResultFiles() {
        return resultFiles;
    }

    /// Returns the zero-based data row index for expanded cases.
    ///
    /// @return row index, or null for cases that were not data-driven
    public Integer getRowIndex() {
        return rowIndex;
    }

    /// Returns the label shown for this result.
    ///
    /// @return display name, never null
    public String getDisplayName() {
        return displayName;
    }

    /// Returns a copy of this result with `extra` appended to its warnings.
    ///
    /// @param extra warnings to append, not null
    /// @return new result, never null
    public CaseResult withWarnings(List<String> extra) {
        return toBuilder().addWarnings(extra).build();
    }

    /// Converts this result to the canonical record handed to result sinks.
    ///
    /// @param traceCaptured whether diagnostic trace capture was enabled for the run
    /// @return canonical outcome record, never null
    public OutcomeRecord toOutcomeRecord(boolean traceCaptured) {
        return OutcomeRecord.from(this, traceCaptured);
    }

    /// Creates a builder pre-populated from this result.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        Builder builder =
                builder(descriptor)
                        .outcome(outcome)
                        .failure(failure)
                        .addWarnings(warnings)
                        .duration(duration)
                        .startTime(startTime)
                        .endTime(endTime)
                        .standardOutput(standardOutput)
                        .diagnosticTrace(diagnosticTrace)
                        .rowIndex(rowIndex)
                        .displayName(displayName);
        resultFiles.forEach(builder::addResultFile);
        return builder;
    }

    @Override
    public String toString() {
        return "CaseResult{"
                + displayName
                + ", outcome="
                + outcome
                + (failure != null ? ", failure=" + failure.kind() : "")
                + (rowIndex != null ? ", row=" + rowIndex : "")
                + '}';
    }

    /// Creates a builder for a result of `descriptor`.
    ///
    /// @param descriptor the descriptor the result belongs to, not null
    /// @return new builder, never null
    public static Builder builder(TestUnitDescriptor descriptor) {
        return new Builder(descriptor);
    }

    /// Creates a finished result carrying only an outcome and a failure.
    ///
    /// Used for results produced without running the case (lifecycle failures,
    /// missing descriptors, cancelled dispatch).
    ///
    /// @param descriptor descriptor the result belongs to, not null
    /// @param outcome final outcome, not null
    /// @param failure failure detail, may be null
    /// @return new result, never null
    public static CaseResult of(
            TestUnitDescriptor descriptor, Outcome outcome, FailureDetail failure) {
        Instant now = Instant.now();
        return builder(descriptor)
                .outcome(outcome)
                .failure(failure)
                .startTime(now)
                .endTime(now)
                .build();
    }

    /// Builder for {@link CaseResult}.
    public static final class Builder {
        private final TestUnitDescriptor descriptor;
        private Outcome outcome = Outcome.PASSED;
        private FailureDetail failure;
        private final List<String> warnings = new ArrayList<>();
        private Duration duration = Duration.ZERO;
        private Instant startTime;
        private Instant endTime;
        private String standardOutput = "";
        private String diagnosticTrace = "";
        private final List<Path> resultFiles = new ArrayList<>();
        private Integer rowIndex;
        private String displayName;

        private Builder(TestUnitDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        public Builder outcome(Outcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder failure(FailureDetail failure) {
            this.failure = failure;
            return this;
        }

        public Builder addWarning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public Builder addWarnings(List<String> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder standardOutput(String standardOutput) {
            this.standardOutput = standardOutput != null ? standardOutput : "";
            return this;
        }

        public Builder diagnosticTrace(String diagnosticTrace) {
            this.diagnosticTrace = diagnosticTrace != null ? diagnosticTrace : "";
            return this;
        }

        public Builder addResultFile(Path resultFile) {
            this.resultFiles.add(resultFile);
            return this;
        }

        public Builder rowIndex(Integer rowIndex) {
            this.rowIndex = rowIndex;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        /// Builds the result, defaulting missing timestamps and the display name.
        ///
        /// @return new result, never null
        public CaseResult build() {
            if (startTime == null) {
                startTime = Instant.now();
            }
            if (endTime == null) {
                endTime = startTime.plus(duration);
            }
            if (displayName == null || displayName.isBlank()) {
                displayName = descriptor.methodName();
            }
            return new CaseResult(this);
        }
    }
}
