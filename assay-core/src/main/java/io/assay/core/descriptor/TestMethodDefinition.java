package io.assay.core.descriptor;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Resolved binding of one test method: its body and everything declared on it.
///
/// ### Contracts
/// - `method` is never null
/// - `dataRows` preserves declaration order; an empty list means the test is either
///   plain or sourced from {@link #getDataSourceName()}
/// - `properties` preserve declaration order and are copied into every case context
///
/// @see MetadataResolver#resolveMethod(TestUnitDescriptor)
public final class TestMethodDefinition {

    private final Method method;
    private final Duration timeout;
    private final ExpectedFailure expectedFailure;
    private final List<DataRow> dataRows;
    private final String dataSourceName;
    private final boolean parallelizable;
    private final String ignoreReason;
    private final Map<String, Object> properties;
    private final String displayName;

    private TestMethodDefinition(Builder builder) {
        this.method = builder.method;
        this.timeout = builder.timeout;
        this.expectedFailure = builder.expectedFailure;
        this.dataRows = List.copyOf(builder.dataRows);
        this.dataSourceName = builder.dataSourceName;
        this.parallelizable = builder.parallelizable;
        this.ignoreReason = builder.ignoreReason;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        this.displayName = builder.displayName;
    }

    public Method getMethod() {
        return method;
    }

    /// Returns the declared timeout.
    ///
    /// @return timeout, or empty when the run default applies
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<ExpectedFailure> getExpectedFailure() {
        return Optional.ofNullable(expectedFailure);
    }

    public List<DataRow> getDataRows() {
        return dataRows;
    }

    /// Returns the name of the external data source feeding this test.
    ///
    /// Only consulted when no inline rows are declared.
    ///
    /// @return data source name, or empty
    public Optional<String> getDataSourceName() {
        return Optional.ofNullable(dataSourceName);
    }

    /// Returns whether the body takes arguments and therefore needs data rows.
    ///
    /// @return true when the method declares parameters
    public boolean isParameterized() {
        return method.getParameterCount() > 0;
    }

    public boolean isDataDriven() {
        return !dataRows.isEmpty() || dataSourceName != null;
    }

    public boolean isParallelizable() {
        return parallelizable;
    }

    public Optional<String> getIgnoreReason() {
        return Optional.ofNullable(ignoreReason);
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public Optional<String> getDisplayName() {
        return Optional.ofNullable(displayName);
    }

    /// Starts a definition for `method`.
    ///
    /// @param method the test body, not null
    /// @return new builder, never null
    public static Builder builder(Method method) {
        return new Builder(method);
    }

    /// Starts a definition for the method named `methodName` declared by `type`.
    ///
    /// @param type declaring class, not null
    /// @param methodName method name, not null
    /// @return new builder, never null
    /// @throws IllegalArgumentException if `type` declares no such method
    public static Builder builder(Class<?> type, String methodName) {
        return new Builder(MethodLookup.declared(type, methodName));
    }

    /// Builder for {@link TestMethodDefinition}.
    public static final class Builder {
        private final Method method;
        private Duration timeout;
        private ExpectedFailure expectedFailure;
        private final List<DataRow> dataRows = new ArrayList<>();
        private String dataSourceName;
        private boolean parallelizable = true;
        private String ignoreReason;
        private final Map<String, Object> properties = new LinkedHashMap<>();
        private String displayName;

        private Builder(Method method) {
            this.method = Objects.requireNonNull(method, "method");
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder expectedFailure(ExpectedFailure expectedFailure) {
            this.expectedFailure = expectedFailure;
            return this;
        }

        public Builder expecting(Class<? extends Throwable> type) {
            return expectedFailure(ExpectedFailure.of(type));
        }

        public Builder row(Object... values) {
            return row(DataRow.of(values));
        }

        public Builder row(DataRow row) {
            this.dataRows.add(row);
            return this;
        }

        public Builder dataSource(String dataSourceName) {
            this.dataSourceName = dataSourceName;
            return this;
        }

        /// Marks the test as one that must never run concurrently with another case.
        ///
        /// @return this builder for chaining, never null
        public Builder doNotParallelize() {
            this.parallelizable = false;
            return this;
        }

        public Builder ignore(String reason) {
            this.ignoreReason = reason;
            return this;
        }

        public Builder property(String name, Object value) {
            this.properties.put(name, value);
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public TestMethodDefinition build() {
            return new TestMethodDefinition(this);
        }
    }
}
