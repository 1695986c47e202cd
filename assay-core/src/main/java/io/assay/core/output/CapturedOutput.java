package io.assay.core.output;

/// Text recorded by a closed {@link OutputScope}.
///
/// @param standardOutput standard output text, never null
/// @param diagnosticTrace diagnostic trace text, never null
public record CapturedOutput(String standardOutput, String diagnosticTrace) {

    public static final CapturedOutput EMPTY = new CapturedOutput("", "");

    /// Returns this output with the diagnostic trace dropped.
    ///
    /// @return output carrying only the standard output text, never null
    public CapturedOutput withoutTrace() {
        return diagnosticTrace.isEmpty() ? this : new CapturedOutput(standardOutput, "");
    }

    public boolean isEmpty() {
        return standardOutput.isEmpty() && diagnosticTrace.isEmpty();
    }
}
