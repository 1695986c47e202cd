package io.assay.core.execution;

import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.output.CapturedOutput;
import io.assay.core.output.OutputChannel;
import io.assay.core.output.OutputMultiplexer;
import io.assay.core.output.OutputScope;
import io.assay.core.result.Outcome;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Per-case state exposed to running test code.
///
/// Test classes receive it through their context slot, a constructor parameter, or a
/// `CaseExecutionContext` parameter on a module or class lifecycle method.
///
/// ### Contracts
/// - Each case gets its own instance; nothing in it is shared with other cases
/// - Properties are copied in at creation: engine properties, then run parameters,
///   then the test's declared properties, the first writer of a name winning
/// - Text written through {@link #out()} and {@link #trace()} lands in this case's
///   output scope from any thread
///
/// @implNote Thread-safe: a case body and its timeout boundary may touch the context
/// from different threads.
public final class CaseExecutionContext {

    /// Property holding the fully qualified test class name.
    public static final String CLASS_NAME_PROPERTY = "className";

    /// Property holding the test method name.
    public static final String METHOD_NAME_PROPERTY = "methodName";

    private final TestUnitDescriptor descriptor;
    private final Map<String, Object> properties;
    private final CancellationHandle cancellation;
    private final OutputMultiplexer multiplexer;
    private final OutputScope scope;
    private final PrintStream out;
    private final PrintStream trace;
    private final List<Path> resultFiles = Collections.synchronizedList(new ArrayList<>());
    private final String displayName;
    private final Integer rowIndex;
    private final List<Object> data;
    private volatile Outcome outcome;

    private CaseExecutionContext(Builder builder) {
        this.descriptor = builder.descriptor;
        this.cancellation = builder.cancellation;
        this.multiplexer = builder.multiplexer;
        this.scope = multiplexer.openScope(builder.parentScope);
        this.out = multiplexer.printStream(scope, OutputChannel.STANDARD_OUTPUT);
        this.trace = multiplexer.printStream(scope, OutputChannel.DIAGNOSTIC_TRACE);
        this.displayName = builder.displayName;
        this.rowIndex = builder.rowIndex;
        this.data = builder.data;

        Map<String, Object> seeded = new LinkedHashMap<>();
        seeded.put(CLASS_NAME_PROPERTY, descriptor.className());
        seeded.put(METHOD_NAME_PROPERTY, descriptor.methodName());
        builder.runParameters.forEach(seeded::putIfAbsent);
        builder.properties.forEach(seeded::putIfAbsent);
        this.properties = Collections.synchronizedMap(seeded);
    }

    public TestUnitDescriptor getDescriptor() {
        return descriptor;
    }

    /// Returns a property value.
    ///
    /// @param name property name, not null
    /// @return value, or empty when unset
    public Optional<Object> getProperty(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    /// Sets a property, replacing any previous value.
    ///
    /// @param name property name, not null
    /// @param value property value, may be null to remove it
    public void setProperty(String name, Object value) {
        if (value == null) {
            properties.remove(name);
        } else {
            properties.put(name, value);
        }
    }

    /// Returns a snapshot of all properties.
    ///
    /// @return property copy in insertion order, never null
    public Map<String, Object> getProperties() {
        synchronized (properties) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
    }

    public CancellationHandle getCancellation() {
        return cancellation;
    }

    public boolean isCancellationRequested() {
        return cancellation.isCancellationRequested();
    }

    /// Reports a provisional outcome, used when the body completes normally.
    ///
    /// @param outcome outcome to report, null to clear
    public void setOutcome(Outcome outcome) {
        this.outcome = outcome;
    }

    /// Returns the outcome set by running code.
    ///
    /// @return explicitly reported outcome, or empty
    public Optional<Outcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }

    /// Returns a stream writing to this case's standard output capture.
    ///
    /// @return print stream, never null
    public PrintStream out() {
        return out;
    }

    /// Returns a stream writing to this case's diagnostic trace capture.
    ///
    /// @return print stream, never null
    public PrintStream trace() {
        return trace;
    }

    public void writeLine(String text) {
        multiplexer.write(scope, OutputChannel.STANDARD_OUTPUT, text + System.lineSeparator());
    }

    public void traceLine(String text) {
        multiplexer.write(scope, OutputChannel.DIAGNOSTIC_TRACE, text + System.lineSeparator());
    }

    /// Attaches a produced file to this case's result.
    ///
    /// @param file path of the file, not null
    public void addResultFile(Path file) {
        resultFiles.add(file);
    }

    public List<Path> getResultFiles() {
        synchronized (resultFiles) {
            return List.copyOf(resultFiles);
        }
    }

    public String getDisplayName() {
        return displayName;
    }

    /// Returns the zero-based row index of a data-driven case.
    ///
    /// @return row index, or null for plain cases
    public Integer getRowIndex() {
        return rowIndex;
    }

    /// Returns the row arguments of a data-driven case.
    ///
    /// @return row values, empty for plain cases
    public List<Object> getData() {
        return data;
    }

    OutputScope getOutputScope() {
        return scope;
    }

    OutputMultiplexer getMultiplexer() {
        return multiplexer;
    }

    CapturedOutput closeOutput() {
        out.flush();
        trace.flush();
        return multiplexer.closeScope(scope);
    }

    /// Creates a builder for the context of a case of `descriptor`.
    ///
    /// @param descriptor the case's descriptor, not null
    /// @param multiplexer output multiplexer of the run, not null
    /// @return new builder, never null
    public static Builder builder(TestUnitDescriptor descriptor, OutputMultiplexer multiplexer) {
        return new Builder(descriptor, multiplexer);
    }

    /// Builder for {@link CaseExecutionContext}.
    public static final class Builder {
        private final TestUnitDescriptor descriptor;
        private final OutputMultiplexer multiplexer;
        private OutputScope parentScope;
        private CancellationHandle cancellation = CancellationHandle.create();
        private Map<String, Object> runParameters = Map.of();
        private Map<String, Object> properties = Map.of();
        private String displayName;
        private Integer rowIndex;
        private List<Object> data = List.of();

        private Builder(TestUnitDescriptor descriptor, OutputMultiplexer multiplexer) {
            this.descriptor = descriptor;
            this.multiplexer = multiplexer;
            this.displayName = descriptor.methodName();
        }

        public Builder parentScope(OutputScope parentScope) {
            this.parentScope = parentScope;
            return this;
        }

        public Builder cancellation(CancellationHandle cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public Builder runParameters(Map<String, Object> runParameters) {
            this.runParameters = runParameters;
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties = properties;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder rowIndex(Integer rowIndex) {
            this.rowIndex = rowIndex;
            return this;
        }

        public Builder data(List<Object> data) {
            this.data = data;
            return this;
        }

        /// Builds the context and opens its output scope.
        ///
        /// @return new context, never null
        public CaseExecutionContext build() {
            return new CaseExecutionContext(this);
        }
    }
}
