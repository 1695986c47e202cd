package io.assay.core.result;

/// Failure information attached to a non-passing {@link CaseResult}.
///
/// `stackTrace`, `exceptionType`, `file` and `line` are only present when the failure
/// originated from a throwable; engine-detected conditions (missing descriptor, argument
/// mismatch, missing expected exception) carry a message only.
///
/// @param kind classification of the originating condition, not null
/// @param message human readable description, not null
/// @param stackTrace filtered stack description, may be null
/// @param exceptionType fully qualified name of the originating throwable, may be null
/// @param file source file of the innermost frame in the test class, may be null
/// @param line line number of that frame, may be null
public record FailureDetail(
        FailureKind kind,
        String message,
        String stackTrace,
        String exceptionType,
        String file,
        Integer line) {

    /// Creates a message-only failure.
    ///
    /// @param kind failure classification, not null
    /// @param message description, not null
    /// @return new failure detail, never null
    public static FailureDetail of(FailureKind kind, String message) {
        return new FailureDetail(kind, message, null, null, null, null);
    }

    /// Creates a failure describing `error`.
    ///
    /// The source location is taken from the innermost frame that belongs to
    /// `testClassName`, when there is one.
    ///
    /// @param kind failure classification, not null
    /// @param message description, not null
    /// @param error originating throwable, not null
    /// @param testClassName class whose frames locate the failure, may be null
    /// @return new failure detail, never null
    public static FailureDetail of(
            FailureKind kind, String message, Throwable error, String testClassName) {
        StackTraceElement location = StackTraces.locate(error, testClassName);
        return new FailureDetail(
                kind,
                message,
                StackTraces.describe(error),
                error.getClass().getName(),
                location != null ? location.getFileName() : null,
                location != null && location.getLineNumber() > 0
                        ? location.getLineNumber()
                        : null);
    }
}
