package io.assay.core.result;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/// Canonical, transport-neutral form of a {@link CaseResult}.
///
/// This is what result sinks persist or forward. The `output` field joins the captured
/// standard output with a delimited `Diagnostic Trace:` section when trace capture was
/// enabled for the run and the case wrote any trace text.
///
/// @param displayName label shown for the case, not null
/// @param fullyQualifiedName `className.methodName`, not null
/// @param moduleName owning module, not null
/// @param outcome final outcome, not null
/// @param duration wall-clock duration, not null
/// @param startTime case start, not null
/// @param endTime case end, not null
/// @param rowIndex data row index, null for plain cases
/// @param failureKind failure classification, null when no failure
/// @param errorMessage failure message, may be null
/// @param errorStackTrace filtered stack description, may be null
/// @param errorFile source file of the failing frame, may be null
/// @param errorLine line of the failing frame, may be null
/// @param output captured text, never null
/// @param warnings secondary diagnostics, never null
/// @param resultFiles result file paths as strings, never null
public record OutcomeRecord(
        String displayName,
        String fullyQualifiedName,
        String moduleName,
        Outcome outcome,
        Duration duration,
        Instant startTime,
        Instant endTime,
        Integer rowIndex,
        FailureKind failureKind,
        String errorMessage,
        String errorStackTrace,
        String errorFile,
        Integer errorLine,
        String output,
        List<String> warnings,
        List<String> resultFiles) {

    static final String TRACE_HEADER = "Diagnostic Trace:";

    public OutcomeRecord {
        output = output != null ? output : "";
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        resultFiles = resultFiles != null ? List.copyOf(resultFiles) : List.of();
    }

    static OutcomeRecord from(CaseResult result, boolean traceCaptured) {
        FailureDetail failure = result.getFailure();
        return new OutcomeRecord(
                result.getDisplayName(),
                result.getDescriptor().fullyQualifiedName(),
                result.getDescriptor().moduleName(),
                result.getOutcome(),
                result.getDuration(),
                result.getStartTime(),
                result.getEndTime(),
                result.getRowIndex(),
                failure != null ? failure.kind() : null,
                failure != null ? failure.message() : null,
                failure != null ? failure.stackTrace() : null,
                failure != null ? failure.file() : null,
                failure != null ? failure.line() : null,
                renderOutput(result, traceCaptured),
                result.getWarnings(),
                result.getResultFiles().stream().map(Object::toString).toList());
    }

    private static String renderOutput(CaseResult result, boolean traceCaptured) {
        String stdout = result.getStandardOutput();
        String trace = result.getDiagnosticTrace();
        if (!traceCaptured || trace.isEmpty()) {
            return stdout;
        }
        StringBuilder sb = new StringBuilder(stdout);
        if (!stdout.isEmpty() && !stdout.endsWith("\n")) {
            sb.append(System.lineSeparator());
        }
        sb.append(System.lineSeparator()).append(TRACE_HEADER).append(System.lineSeparator());
        sb.append(trace);
        return sb.toString();
    }
}
